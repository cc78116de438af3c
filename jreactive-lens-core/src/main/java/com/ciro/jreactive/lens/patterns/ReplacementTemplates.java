package com.ciro.jreactive.lens.patterns;

import java.util.Locale;

/**
 * Fragmentos JReactive sugeridos para cada idioma detectado.
 * Se parametrizan con el nombre de la variable, su valor inicial y el tipo Java del campo {@code @State}.
 * El resultado es texto opaco: nadie lo parsea ni lo compila.
 */
public final class ReplacementTemplates {

    private ReplacementTemplates() {}

    public static String forKind(PatternKind kind, String varName, String initialValue, String javaType) {
        String name = (varName == null || varName.isBlank()) ? defaultName(kind) : varName;
        String init = (initialValue == null || initialValue.isBlank()) ? defaultInit(javaType) : toJavaLiteral(initialValue);
        String type = (javaType == null || javaType.isBlank()) ? "String" : javaType;

        return switch (kind) {
            case TABS -> tabs(name, init, type);
            case FILTER -> filter(name, init, type);
            case FORM_DEPENDENCIES -> formDependencies(name);
            case MODAL -> modal(name);
            case PAGINATION -> pagination(name, init, type);
            case ACCORDION -> accordion(name, init);
            case TOGGLE -> toggle(name, init);
            case SORTABLE_TABLE -> sortable(name);
            case DARK_MODE -> darkMode(name);
            case SIDE_EFFECT -> sideEffect();
        };
    }

    /** Sin variable conocida (detección sobre texto crudo). */
    public static String forKind(PatternKind kind) {
        return forKind(kind, null, null, null);
    }

    static String tabs(String name, String init, String type) {
        return """
            @State public %2$s %1$s = %3$s;

            @Call
            public void select%4$s(%2$s tab) {
                this.%1$s = tab;
            }

            // template()
            <nav class="tabs">
              <button @click="select%4$s('home')">Home</button>
              <button @click="select%4$s('profile')">Profile</button>
            </nav>
            <section>{{%1$s}}</section>
            """.formatted(name, type, init, capitalize(name));
    }

    static String filter(String name, String init, String type) {
        return """
            @State public %2$s %1$s = %3$s;
            @State public List<Object> results = new ArrayList<>();

            @Call
            public void apply%4$s(%2$s value) {
                this.%1$s = value;
                this.results = service.search(value); // el filtrado se hace en el servidor
            }

            // template()
            <input name="%1$s" type="search" placeholder="Search...">
            <button @click="apply%4$s(%1$s)">Search</button>
            {{#each results as item}}
              <li>{{item}}</li>
            {{/each}}
            """.formatted(name, type, init, capitalize(name));
    }

    static String formDependencies(String name) {
        return """
            @State public boolean %1$s = false;

            // template(): el campo dependiente solo se pinta si se cumple la condición
            <input type="checkbox" name="%1$s"/>
            {{#if %1$s}}
              <input name="details" placeholder="Details">
            {{/if}}
            """.formatted(name);
    }

    static String modal(String name) {
        return """
            @Call
            public void confirm() {
                findChild("%1$s", JModal.class).close();
            }

            // template()
            <button @click="%1$s.open()">Open</button>
            <JModal ref="%1$s" title="Confirm">
              <p>...</p>
              <button @click="%1$s.close()">Cancel</button>
              <button @click="confirm()">OK</button>
            </JModal>
            """.formatted(name);
    }

    static String pagination(String name, String init, String type) {
        String numeric = type.equals("int") || type.equals("double") ? type : "int";
        String start = type.equals(numeric) ? init : "0";
        return """
            @State public %2$s %1$s = %3$s;
            @State public List<Object> pageItems = new ArrayList<>();

            @Call
            public void nextPage() {
                %1$s++;
                pageItems = service.page(%1$s, 20);
            }

            @Call
            public void prevPage() {
                if (%1$s > 0) %1$s--;
                pageItems = service.page(%1$s, 20);
            }

            // template()
            {{#each pageItems as item}}
              <li>{{item}}</li>
            {{/each}}
            <button @click="prevPage()">Previous</button>
            <span>{{%1$s}}</span>
            <button @click="nextPage()">Next</button>
            """.formatted(name, numeric, start);
    }

    static String accordion(String name, String init) {
        return """
            @State public boolean %1$s = %2$s;

            @Call
            public void toggle%3$s() {
                %1$s = !%1$s;
            }

            // template()
            <button @click="toggle%3$s()" aria-expanded="{{%1$s}}">Section</button>
            {{#if %1$s}}
              <div class="panel">...</div>
            {{/if}}
            """.formatted(name, booleanInit(init), capitalize(name));
    }

    static String toggle(String name, String init) {
        return """
            @State public boolean %1$s = %2$s;

            @Call
            public void toggle%3$s() {
                %1$s = !%1$s;
            }

            // template()
            <button @click="toggle%3$s()">Toggle</button>
            {{#if %1$s}}<span>ON</span>{{/if}}
            {{#if !%1$s}}<span>OFF</span>{{/if}}
            """.formatted(name, booleanInit(init), capitalize(name));
    }

    static String sortable(String name) {
        return """
            @State public String %1$s = "name";
            @State public boolean ascending = true;
            @State public List<Object> rows = new ArrayList<>();

            @Call
            public void sortBy(String column) {
                ascending = column.equals(%1$s) ? !ascending : true;
                %1$s = column;
                rows = service.sorted(column, ascending);
            }

            // template()
            <th @click="sortBy('name')">Name</th>
            {{#each rows as row}}
              <tr><td>{{row.name}}</td></tr>
            {{/each}}
            """.formatted(name);
    }

    static String darkMode(String name) {
        return """
            @State public boolean %1$s = false;

            @Call
            public void toggleTheme() {
                %1$s = !%1$s;
            }

            // template(): la preferencia del sistema se lee en el cliente
            <div class="{{#if %1$s}}dark{{/if}}" client:mount="Theme_mount(this)">
              <button @click="toggleTheme()">🌓</button>
            </div>
            """.formatted(name);
    }

    static String sideEffect() {
        return """
            // Trabajo de servidor: onMount()/onUnmount() del HtmlComponent
            @Override
            protected void onMount() {
                // cargar datos, suscribirse...
            }

            // Trabajo de DOM: client:mount="Component_mount(this)" en la plantilla
            """;
    }

    // ==============================================================
    // Helpers
    // ==============================================================

    static String capitalize(String s) {
        if (s == null || s.isEmpty()) return "";
        return s.substring(0, 1).toUpperCase(Locale.ROOT) + s.substring(1);
    }

    /** Comillas JS simples o backticks pasan a literal Java con comillas dobles. */
    static String toJavaLiteral(String jsLiteral) {
        String v = jsLiteral.trim();
        if (v.length() >= 2 && (v.charAt(0) == '\'' || v.charAt(0) == '`') && v.charAt(v.length() - 1) == v.charAt(0)) {
            String inner = v.substring(1, v.length() - 1).replace("\"", "\\\"");
            return "\"" + inner + "\"";
        }
        if (v.startsWith("[")) return "new ArrayList<>()";
        if (v.startsWith("{")) return "new HashMap<>()";
        if (v.equals("undefined")) return "null";
        return v;
    }

    private static String booleanInit(String init) {
        return init.equals("true") ? "true" : "false";
    }

    private static String defaultInit(String javaType) {
        if (javaType == null) return "\"\"";
        return switch (javaType) {
            case "boolean" -> "false";
            case "int" -> "0";
            case "double" -> "0.0";
            case "String" -> "\"\"";
            default -> "null";
        };
    }

    private static String defaultName(PatternKind kind) {
        return switch (kind) {
            case TABS -> "activeTab";
            case FILTER -> "query";
            case FORM_DEPENDENCIES -> "enabled";
            case MODAL -> "modal";
            case PAGINATION -> "page";
            case ACCORDION -> "expanded";
            case TOGGLE -> "active";
            case SORTABLE_TABLE -> "sortColumn";
            case DARK_MODE -> "darkMode";
            case SIDE_EFFECT -> "effect";
        };
    }
}
