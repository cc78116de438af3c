package com.ciro.jreactive.lens.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

/** Reconocimiento de map / && / ternario dentro de {...} y sus sub-parseos. */
class ExpressionAnalysisTest {

    private static JsxNode onlyChild(String markup) {
        ElementNode el = assertInstanceOf(ElementNode.class, JsxParser.parseMarkup(markup));
        assertEquals(1, el.children.size(), "hijos de " + markup);
        return el.children.get(0);
    }

    @Test
    void iterationWithIndex() {
        EachNode each = assertInstanceOf(EachNode.class,
                onlyChild("<ul>{items.map((item, i) => <li key={i}>{item.name}</li>)}</ul>"));

        assertEquals("items", each.collection);
        assertEquals("item", each.itemVar);
        assertEquals("i", each.indexVar);
        ElementNode li = assertInstanceOf(ElementNode.class, each.body);
        assertEquals("li", li.tagName);
        assertEquals("item.name", assertInstanceOf(ExpressionNode.class, li.children.get(0)).raw);
    }

    @Test
    void iterationWithParenthesisedBody() {
        EachNode each = assertInstanceOf(EachNode.class, onlyChild("""
            <ul>{todos.map(todo => (
              <Todo key={todo.id} {...todo} />
            ))}</ul>"""));

        assertNull(each.indexVar);
        ElementNode todo = assertInstanceOf(ElementNode.class, each.body);
        assertEquals("Todo", todo.tagName);
        assertTrue(todo.isSelfClosing);
        assertEquals(1, todo.spreads().size());
    }

    @Test
    void iterationWithBlockBody() {
        EachNode each = assertInstanceOf(EachNode.class,
                onlyChild("<tbody>{rows.map(row => { const k = row.id; return (<tr key={k}/>); })}</tbody>"));

        assertEquals("row", each.itemVar);
        assertEquals("tr", assertInstanceOf(ElementNode.class, each.body).tagName);
    }

    @Test
    void iterationWithEarlyReturnUsesReturnedMarkup() {
        EachNode each = assertInstanceOf(EachNode.class,
                onlyChild("<ul>{rows.map(row => { if (!row) return null; return <li>{row}</li>; })}</ul>"));

        ElementNode li = assertInstanceOf(ElementNode.class, each.body);
        assertEquals("li", li.tagName);
        assertEquals("row", assertInstanceOf(ExpressionNode.class, li.children.get(0)).raw);
    }

    @Test
    void iterationWithoutMarkupReturnKeepsLastReturn() {
        EachNode each = assertInstanceOf(EachNode.class,
                onlyChild("<ul>{rows.map(row => { if (!row) return 0; return row.label; })}</ul>"));

        assertEquals("row.label", assertInstanceOf(TextNode.class, each.body).text);
    }

    @Test
    void iterationOnMemberCollection() {
        EachNode each = assertInstanceOf(EachNode.class,
                onlyChild("<ul>{props.users.map(u => <li>{u}</li>)}</ul>"));

        assertEquals("props.users", each.collection);
    }

    @Test
    void guard() {
        GuardNode guard = assertInstanceOf(GuardNode.class, onlyChild("<div>{isOpen && <Modal onClose={close} />}</div>"));

        assertEquals("isOpen", guard.condition);
        assertEquals("Modal", assertInstanceOf(ElementNode.class, guard.consequent).tagName);
    }

    @Test
    void guardWithParenthesisedBody() {
        GuardNode guard = assertInstanceOf(GuardNode.class, onlyChild("""
            <div>{user && (
              <p>{user.name}</p>
            )}</div>"""));

        ElementNode p = assertInstanceOf(ElementNode.class, guard.consequent);
        assertEquals("p", p.tagName);
        assertEquals(2, p.line);
    }

    @Test
    void guardAroundIteration() {
        GuardNode guard = assertInstanceOf(GuardNode.class,
                onlyChild("<ul>{items.length > 0 && items.map(i => <li>{i}</li>)}</ul>"));

        assertEquals("items.length > 0", guard.condition);
        EachNode each = assertInstanceOf(EachNode.class, guard.consequent);
        assertEquals("li", assertInstanceOf(ElementNode.class, each.body).tagName);
    }

    @Test
    void nestedTernaryInAlternateSplitsAtFirstTopLevelColon() {
        TernaryNode outer = assertInstanceOf(TernaryNode.class, onlyChild("<div>{a ? <X/> : b ? <Y/> : <Z/>}</div>"));

        assertEquals("a", outer.condition);
        assertEquals("X", assertInstanceOf(ElementNode.class, outer.consequent).tagName);

        TernaryNode inner = assertInstanceOf(TernaryNode.class, outer.alternate);
        assertEquals("b", inner.condition);
        assertEquals("Y", assertInstanceOf(ElementNode.class, inner.consequent).tagName);
        assertEquals("Z", assertInstanceOf(ElementNode.class, inner.alternate).tagName);
    }

    @Test
    void ternaryColonSplitBeforeReparse() {
        String rest = "<X/> : b ? <Y/> : <Z/>";
        int colon = JsxParser.findTernaryColon(rest);

        assertEquals(5, colon);
        assertEquals("<X/>", rest.substring(0, colon).trim());
        assertEquals("b ? <Y/> : <Z/>", rest.substring(colon + 1).trim());
    }

    @Test
    void ternaryColonIgnoresBracketedColons() {
        assertEquals(9, JsxParser.findTernaryColon("fn(a, b) : c"));
        assertEquals(7, JsxParser.findTernaryColon("{a: 1} : b"));
        assertEquals(-1, JsxParser.findTernaryColon("a ?? b"));
    }

    @Test
    void ternaryNestedInConsequentStaysRaw() {
        // el '?' anidado sube la profundidad y el ':' nunca la baja
        assertEquals(-1, JsxParser.findTernaryColon("b ? <X/> : <Y/> : <Z/>"));

        ExpressionNode expr = assertInstanceOf(ExpressionNode.class,
                onlyChild("<div>{a ? b ? <X/> : <Y/> : <Z/>}</div>"));
        assertEquals("a ? b ? <X/> : <Y/> : <Z/>", expr.raw);
    }

    @Test
    void ternaryWithNullAlternate() {
        TernaryNode t = assertInstanceOf(TernaryNode.class, onlyChild("<div>{loading ? <Spinner/> : null}</div>"));

        assertEquals("Spinner", assertInstanceOf(ElementNode.class, t.consequent).tagName);
        assertNull(t.alternate);
    }

    @Test
    void unrecognisedExpressionStaysRaw() {
        ExpressionNode expr = assertInstanceOf(ExpressionNode.class, onlyChild("<p>{count + 1}</p>"));

        assertEquals("count + 1", expr.raw);
    }

    @Test
    void subParseLinesAreAbsolute() {
        ElementNode ul = assertInstanceOf(ElementNode.class, JsxParser.parseMarkup("""
            <ul>
            {items.map(i => (
              <li>{i}</li>
            ))}
            </ul>"""));

        EachNode each = assertInstanceOf(EachNode.class, ul.children.get(0));
        assertEquals(2, each.line);
        assertEquals(3, assertInstanceOf(ElementNode.class, each.body).line);
    }

    @Test
    void guardBodyWarningsKeepAbsolutePosition() {
        ParseResult result = JsxParser.parse(
                "function C() {\n  return <div>          {ok && <span></b>}</div>;\n}");

        assertEquals(List.of(new Warning(2, 38, "Mismatched closing tag: expected </span>, got </b>")),
                result.warnings());
    }

    @Test
    void ternaryBranchWarningsOnLaterLines() {
        ParseResult result = JsxParser.parse("""
            function C() {
              return (
                <div>
                  {open ? (
                    <p>ok</p>
                  ) : (
                    <i></em>
                  )}
                </div>
              );
            }
            """);

        assertEquals(List.of(new Warning(7, 12, "Mismatched closing tag: expected </i>, got </em>")),
                result.warnings());
    }

    @Test
    void stripOuterParensOnlyWhenTheyWrapEverything() {
        assertEquals("<p/>", JsxParser.stripOuterParens("  (<p/>)  "));
        assertEquals("(a) && (b)", JsxParser.stripOuterParens("(a) && (b)"));
        assertEquals("x", JsxParser.stripOuterParens("x"));
    }
}
