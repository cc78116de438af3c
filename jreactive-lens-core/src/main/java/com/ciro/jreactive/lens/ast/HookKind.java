package com.ciro.jreactive.lens.ast;

/**
 * Hooks de React conocidos, con la pista de migración a JReactive que genera cada uno.
 */
public enum HookKind {
    STATE("useState", "useState",
          "Consider: @State field on the HtmlComponent; the server keeps the value"),
    EFFECT("useEffect", "useEffect",
           "Consider: onMount()/onUnmount() on the server, or client:mount for DOM-only work"),
    LAYOUT_EFFECT("useLayoutEffect", "useEffect",
                  "Consider: client:mount hook; layout work stays in the browser"),
    MEMO("useMemo", "memoization",
         "Consider: a plain Java getter; no memoization needed server-side"),
    CALLBACK("useCallback", "memoization",
             "Consider: a @Call method; handlers are not re-created on the server"),
    CONTEXT("useContext", "useContext",
            "Consider: @Bind props from the parent or a shared Spring bean"),
    REF("useRef", "useRef",
        "Consider: ref=\"alias\" on the child component or client:mount for DOM references"),
    REDUCER("useReducer", "useReducer",
            "Consider: @State fields plus one @Call method per action"),
    CUSTOM(null, "customHook",
           "Consider: extract the logic into a Java service or a reusable HtmlComponent");

    private final String hookName;
    private final String category;
    private final String hint;

    HookKind(String hookName, String category, String hint) {
        this.hookName = hookName;
        this.category = category;
        this.hint = hint;
    }

    public String category() { return category; }
    public String hint() { return hint; }

    public boolean isEffect() {
        return this == EFFECT || this == LAYOUT_EFFECT;
    }

    public static HookKind of(String name) {
        for (HookKind k : values()) {
            if (k.hookName != null && k.hookName.equals(name)) return k;
        }
        return CUSTOM;
    }

    /** Convención React: {@code use} seguido de mayúscula. */
    public static boolean isHookName(String name) {
        return name != null && name.length() > 3 && name.startsWith("use") && Character.isUpperCase(name.charAt(3));
    }
}
