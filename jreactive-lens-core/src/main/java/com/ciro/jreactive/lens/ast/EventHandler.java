package com.ciro.jreactive.lens.ast;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Manejador {@code onX={...}} con los setters que invoca y los identificadores que lee.
 */
public record EventHandler(String eventType,
                           String body,
                           boolean inline,
                           List<String> setterCalls,
                           List<String> referencedNames,
                           int line) {

    private static final Pattern EVENT_ATTR = Pattern.compile("on[A-Z].*");

    public EventHandler {
        setterCalls = List.copyOf(setterCalls);
        referencedNames = List.copyOf(referencedNames);
    }

    public static boolean isEventAttribute(String name) {
        return name != null && EVENT_ATTR.matcher(name).matches();
    }
}
