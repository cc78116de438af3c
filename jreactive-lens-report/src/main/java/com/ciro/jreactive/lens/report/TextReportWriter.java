package com.ciro.jreactive.lens.report;

import com.ciro.jreactive.lens.AnalysisResult;
import com.ciro.jreactive.lens.ast.ComponentNode;
import com.ciro.jreactive.lens.ast.Hook;
import com.ciro.jreactive.lens.ast.Suggestion;
import com.ciro.jreactive.lens.ast.Warning;
import com.ciro.jreactive.lens.patterns.DetectedPattern;

/**
 * Listado legible de un análisis: hooks por componente, sugerencias, patrones y warnings.
 * <pre>
 * [HIGH] Tab UI pattern detected (line 12)
 *   role="tablist"
 *     &#64;State public String activeTab = "";
 * </pre>
 */
public class TextReportWriter {

    public String write(AnalysisResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Analysis: ").append(result.sourceName()).append(" ===\n");

        for (ComponentNode comp : result.parse().file().components) {
            sb.append("\nComponent ").append(comp.name)
              .append(comp.exported ? " (exported)" : "")
              .append(" - line ").append(comp.line).append('\n');

            if (comp.hooks.isEmpty()) {
                sb.append("  no hooks\n");
            }
            for (Hook h : comp.hooks) {
                sb.append("  ").append(h.name());
                if (h.boundName() != null) sb.append(" -> ").append(h.boundName());
                sb.append(" (line ").append(h.line()).append(")\n");
            }
        }

        if (!result.parse().suggestions().isEmpty()) {
            sb.append("\nSuggestions:\n");
            for (Suggestion s : result.parse().suggestions()) {
                sb.append("  line ").append(s.line()).append(": ").append(s.originalText())
                  .append(" - ").append(s.hint()).append('\n');
            }
        }

        sb.append("\nPatterns:\n");
        if (result.patterns().isEmpty()) sb.append("  none\n");
        for (DetectedPattern p : result.patterns()) {
            sb.append("[").append(p.band()).append("] ").append(p.description())
              .append(" (line ").append(p.line()).append(")\n");
            if (p.snippet() != null && !p.snippet().isEmpty()) {
                sb.append("  ").append(p.snippet()).append('\n');
            }
            indent(sb, p.replacement(), "    ");
        }

        if (!result.parse().warnings().isEmpty()) {
            sb.append("\nWarnings:\n");
            for (Warning w : result.parse().warnings()) {
                sb.append("  ").append(w.line()).append(':').append(w.column())
                  .append(" ").append(w.message()).append('\n');
            }
        }
        return sb.toString();
    }

    private static void indent(StringBuilder sb, String text, String prefix) {
        if (text == null) return;
        text.lines().forEach(l -> sb.append(prefix).append(l).append('\n'));
    }
}
