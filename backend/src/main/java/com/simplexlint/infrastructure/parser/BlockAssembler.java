package com.simplexlint.infrastructure.parser;

import com.simplexlint.domain.spec.model.FunctionBlock;
import com.simplexlint.domain.spec.model.Landmark;
import com.simplexlint.domain.spec.model.LandmarkNames;
import com.simplexlint.domain.spec.model.ParsedSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Slices the content between landmark declarations and groups the landmarks into
 * FUNCTION blocks, DATA blocks and CONSTRAINTs in a single pass.
 *
 * FUNCTIONs never nest, so one "current function" reference is enough:
 *   FUNCTION            → opens a new block
 *   DATA / CONSTRAINT   → top-level, closes the current block
 *   function-scoped     → attaches to the current block (last one wins), warns if none is open
 *   anything else       → warns as unrecognized
 */
@Component
@RequiredArgsConstructor
public class BlockAssembler {

    private final SignatureParser signatureParser;

    public ParsedSpec assemble(String text, List<LandmarkMatch> matches) {
        List<Landmark> landmarks = sliceContent(text, matches);

        List<FunctionDraft> drafts = new ArrayList<>();
        List<Landmark> dataBlocks = new ArrayList<>();
        List<Landmark> constraints = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        FunctionDraft current = null;

        for (Landmark landmark : landmarks) {
            String name = landmark.name();

            if (LandmarkNames.FUNCTION.equals(name)) {
                current = new FunctionDraft(signatureParser.parse(landmark.content()), landmark.lineNumber());
                drafts.add(current);
            } else if (LandmarkNames.DATA.equals(name)) {
                dataBlocks.add(landmark);
                current = null;
            } else if (LandmarkNames.CONSTRAINT.equals(name)) {
                constraints.add(landmark);
                current = null;
            } else if (LandmarkNames.isFunctionScoped(name)) {
                if (current != null) {
                    current.landmarks.put(name, landmark);
                } else {
                    warnings.add(String.format("landmark %s at line %d appears outside FUNCTION block",
                            name, landmark.lineNumber()));
                }
            } else {
                warnings.add(String.format("unrecognized landmark: %s at line %d",
                        name, landmark.lineNumber()));
            }
        }

        List<FunctionBlock> functions = drafts.stream()
                .map(FunctionDraft::build)
                .toList();

        return new ParsedSpec(functions, dataBlocks, constraints, text, warnings);
    }

    /**
     * Content runs from the end of the declaration line to the next declaration (or end of text),
     * trimmed, with the same-line remainder prepended on its own line.
     */
    List<Landmark> sliceContent(String text, List<LandmarkMatch> matches) {
        List<Landmark> landmarks = new ArrayList<>(matches.size());

        for (int i = 0; i < matches.size(); i++) {
            LandmarkMatch match = matches.get(i);
            int end = i + 1 < matches.size() ? matches.get(i + 1).startIndex() : text.length();
            String body = text.substring(match.endIndex(), end).strip();

            String content;
            if (match.sameLine().isEmpty()) {
                content = body;
            } else if (body.isEmpty()) {
                content = match.sameLine();
            } else {
                content = match.sameLine() + "\n" + body;
            }

            landmarks.add(new Landmark(match.name(), content, match.lineNumber()));
        }

        return landmarks;
    }

    private static final class FunctionDraft {

        private final Signature signature;
        private final int lineNumber;
        private final Map<String, Landmark> landmarks = new LinkedHashMap<>();

        private FunctionDraft(Signature signature, int lineNumber) {
            this.signature = signature;
            this.lineNumber = lineNumber;
        }

        private FunctionBlock build() {
            return new FunctionBlock(
                    signature.line(),
                    signature.name(),
                    signature.inputs(),
                    signature.returnType(),
                    landmarks,
                    lineNumber
            );
        }
    }
}
