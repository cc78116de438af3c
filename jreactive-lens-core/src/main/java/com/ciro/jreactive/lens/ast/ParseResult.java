package com.ciro.jreactive.lens.ast;

import java.util.List;

public record ParseResult(ParsedFile file, List<Warning> warnings, List<Suggestion> suggestions) {

    public ParseResult {
        warnings = List.copyOf(warnings);
        suggestions = List.copyOf(suggestions);
    }
}
