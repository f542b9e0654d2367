package com.simplexlint.infrastructure.parser;

import com.simplexlint.domain.spec.model.ParsedSpec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Tolerant parser for landmark-based specifications. No grammar is enforced:
 * structure is recovered from landmark declarations and everything between
 * them is kept as opaque content.
 *
 * Never throws on malformed input; at worst the result has no functions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SoftParser {

    private final LandmarkScanner scanner;
    private final BlockAssembler assembler;

    /**
     * Wires the default scanner and assembler without a Spring context.
     */
    public static SoftParser create() {
        return new SoftParser(new LandmarkScanner(), new BlockAssembler(new SignatureParser()));
    }

    public ParsedSpec parse(String text) {
        String source = text != null ? text : "";

        List<LandmarkMatch> matches = scanner.scan(source);
        if (matches.isEmpty()) {
            log.debug("No landmarks found in {} chars of input", source.length());
            return ParsedSpec.empty(source);
        }

        ParsedSpec spec = assembler.assemble(source, matches);
        log.debug("Parsed {} landmarks into {} functions, {} data blocks, {} constraints ({} warnings)",
                matches.size(), spec.functions().size(), spec.dataBlocks().size(),
                spec.constraints().size(), spec.parseWarnings().size());
        return spec;
    }
}
