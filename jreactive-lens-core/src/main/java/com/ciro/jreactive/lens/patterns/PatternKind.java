package com.ciro.jreactive.lens.patterns;

/** Idiomas de interfaz que sabemos reconocer en un componente React. */
public enum PatternKind {
    TABS("tabs", "Tabs"),
    FILTER("filter", "Filter/search"),
    FORM_DEPENDENCIES("form-dependencies", "Form dependencies"),
    MODAL("modal", "Modal"),
    PAGINATION("pagination", "Pagination"),
    ACCORDION("accordion", "Accordion"),
    TOGGLE("toggle", "Toggle"),
    SORTABLE_TABLE("sortable-table", "Sortable table"),
    DARK_MODE("dark-mode", "Dark mode"),
    SIDE_EFFECT("effect", "Side effect");

    private final String id;
    private final String label;

    PatternKind(String id, String label) {
        this.id = id;
        this.label = label;
    }

    public String id() { return id; }
    public String label() { return label; }
}
