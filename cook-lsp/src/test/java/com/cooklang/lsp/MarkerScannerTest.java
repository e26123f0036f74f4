package com.cooklang.lsp;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("MarkerScanner 测试")
class MarkerScannerTest {

    private static byte[] bytes(String text) {
        return text.getBytes(StandardCharsets.UTF_8);
    }

    /** 光标位于文本末尾时的上下文 */
    private static CompletionContext contextAtEnd(String text) {
        byte[] b = bytes(text);
        return MarkerScanner.completionContext(b, b.length);
    }

    // ============ 补全上下文 ============

    @Nested
    @DisplayName("completionContext")
    class Context {

        @Test
        @DisplayName("食材名称前缀")
        void testIngredientName() {
            CompletionContext ctx = contextAtEnd("Add @garl");
            assertThat(ctx.getType()).isEqualTo(CompletionContext.Type.NAME);
            assertThat(ctx.getKind()).isEqualTo(ElementKind.INGREDIENT);
            assertThat(ctx.getPrefix()).isEqualTo("garl");
        }

        @Test
        @DisplayName("厨具与计时器名称")
        void testCookwareAndTimerNames() {
            assertThat(contextAtEnd("Use a #sk").getKind()).isEqualTo(ElementKind.COOKWARE);
            CompletionContext timer = contextAtEnd("Wait ~res");
            assertThat(timer.getKind()).isEqualTo(ElementKind.TIMER);
            assertThat(timer.getPrefix()).isEqualTo("res");
        }

        @Test
        @DisplayName("'%' 之后是单位")
        void testUnit() {
            CompletionContext ctx = contextAtEnd("@flour{200%g");
            assertThat(ctx.getType()).isEqualTo(CompletionContext.Type.UNIT);
            assertThat(ctx.getPrefix()).isEqualTo("g");
        }

        @Test
        @DisplayName("花括号内是数量")
        void testQuantity() {
            CompletionContext ctx = contextAtEnd("@flour{20");
            assertThat(ctx.getType()).isEqualTo(CompletionContext.Type.QUANTITY);
            assertThat(ctx.getPrefix()).isEqualTo("20");
        }

        @Test
        @DisplayName("已闭合的组件之后没有上下文")
        void testClosed() {
            assertThat(contextAtEnd("@flour{200}").getType()).isEqualTo(CompletionContext.Type.NONE);
            assertThat(contextAtEnd("plain text").getType()).isEqualTo(CompletionContext.Type.NONE);
        }

        @Test
        @DisplayName("转义的标记不是组件")
        void testEscaped() {
            assertThat(contextAtEnd("mail me \\@home").getType()).isEqualTo(CompletionContext.Type.NONE);
        }

        @Test
        @DisplayName("花括号内的标记是内容")
        void testMarkerInsideBraces() {
            CompletionContext ctx = contextAtEnd("@flour{a#b");
            assertThat(ctx.getType()).isEqualTo(CompletionContext.Type.QUANTITY);
            assertThat(ctx.getKind()).isEqualTo(ElementKind.INGREDIENT);
        }

        @Test
        @DisplayName("不跨行回溯")
        void testDoesNotCrossLines() {
            assertThat(contextAtEnd("@flour{200\nnext").getType()).isEqualTo(CompletionContext.Type.NONE);
        }

        @Test
        @DisplayName("超出回溯窗口的标记找不到")
        void testWindowBound() {
            StringBuilder sb = new StringBuilder("@salt");
            for (int i = 0; i < MarkerScanner.CONTEXT_WINDOW; i++) sb.append('x');
            assertThat(contextAtEnd(sb.toString()).getType()).isEqualTo(CompletionContext.Type.NONE);
        }

        @Test
        @DisplayName("窗口起点落在多字节字符内部时前移到字符边界")
        void testWindowSnapsToBoundary() {
            StringBuilder sb = new StringBuilder();
            for (int i = 0; i < 150; i++) sb.append('é');
            sb.append("@on");
            CompletionContext ctx = contextAtEnd(sb.toString());
            assertThat(ctx.getType()).isEqualTo(CompletionContext.Type.NAME);
            assertThat(ctx.getPrefix()).isEqualTo("on");
        }
    }

    // ============ 光标处元素 ============

    @Nested
    @DisplayName("elementAt")
    class ElementAt {

        @Test
        @DisplayName("单词食材")
        void testSingleWord() {
            ElementSpan span = MarkerScanner.elementAt(bytes("Add @salt now"), 6);
            assertThat(span.getKind()).isEqualTo(ElementKind.INGREDIENT);
            assertThat(span.getText()).isEqualTo("@salt");
            assertThat(span.getName()).isEqualTo("salt");
        }

        @Test
        @DisplayName("多词名称与数量")
        void testMultiWord() {
            ElementSpan span = MarkerScanner.elementAt(bytes("Add @olive oil{2%tbsp} now"), 8);
            assertThat(span.getText()).isEqualTo("@olive oil{2%tbsp}");
            assertThat(span.getName()).isEqualTo("olive oil");
            assertThat(span.getBraceContent()).isEqualTo("2%tbsp");
        }

        @Test
        @DisplayName("光标在标记上")
        void testOnMarker() {
            ElementSpan span = MarkerScanner.elementAt(bytes("in a #pan"), 5);
            assertThat(span.getKind()).isEqualTo(ElementKind.COOKWARE);
            assertThat(span.getStart()).isEqualTo(5);
            assertThat(span.getEnd()).isEqualTo(9);
        }

        @Test
        @DisplayName("单词结束后的文本不属于元素")
        void testAfterWord() {
            assertThat(MarkerScanner.elementAt(bytes("@salt and"), 7)).isNull();
        }

        @Test
        @DisplayName("整行元素")
        void testWholeLine() {
            byte[] text = bytes("-- note\n== Dough ==\n>> servings: 2");
            assertThat(MarkerScanner.elementAt(text, 3).getKind()).isEqualTo(ElementKind.COMMENT);
            ElementSpan section = MarkerScanner.elementAt(text, 10);
            assertThat(section.getKind()).isEqualTo(ElementKind.SECTION);
            assertThat(section.getText()).isEqualTo("== Dough ==");
            assertThat(MarkerScanner.elementAt(text, 25).getKind()).isEqualTo(ElementKind.METADATA);
        }

        @Test
        @DisplayName("行终止符与文末不属于任何元素")
        void testOutside() {
            byte[] text = bytes("@salt\n");
            assertThat(MarkerScanner.elementAt(text, 5)).isNull();
            assertThat(MarkerScanner.elementAt(text, 6)).isNull();
            assertThat(MarkerScanner.elementAt(text, -1)).isNull();
        }

        @Test
        @DisplayName("未闭合的花括号延伸到行尾")
        void testUnclosedBrace() {
            ElementSpan span = MarkerScanner.elementAt(bytes("@flour{200\nnext"), 2);
            assertThat(span.getEnd()).isEqualTo(10);
        }

        @Test
        @DisplayName("行内注释中的标记属于注释")
        void testInsideInlineComment() {
            ElementSpan span = MarkerScanner.elementAt(bytes("Stir -- add @salt"), 13);
            assertThat(span.getKind()).isEqualTo(ElementKind.COMMENT);
            assertThat(span.getStart()).isEqualTo(5);
            assertThat(span.getEnd()).isEqualTo(17);

            byte[] block = bytes("Stir [- @salt -] well");
            ElementSpan blockSpan = MarkerScanner.elementAt(block, 9);
            assertThat(blockSpan.getKind()).isEqualTo(ElementKind.COMMENT);
            assertThat(blockSpan.getText()).isEqualTo("[- @salt -]");
            assertThat(MarkerScanner.elementAt(block, 18)).isNull();
        }

        @Test
        @DisplayName("花括号内的 -- 不是注释")
        void testDashesInsideBraces() {
            ElementSpan span = MarkerScanner.elementAt(bytes("Use @salt{a--b}"), 10);
            assertThat(span.getKind()).isEqualTo(ElementKind.INGREDIENT);
            assertThat(span.getText()).isEqualTo("@salt{a--b}");
        }

        @Test
        @DisplayName("悬停结果与分词结果一致")
        void testAgreesWithTokenize() {
            byte[] text = bytes("Mix @flour -- then @salt\nStir [- #pan -] ~{5%min}");
            List<ElementSpan> spans = MarkerScanner.tokenize(text);
            for (int offset = 0; offset < text.length; offset++) {
                ElementSpan hovered = MarkerScanner.elementAt(text, offset);
                ElementSpan token = null;
                for (ElementSpan span : spans) {
                    if (span.contains(offset)) token = span;
                }
                if (token == null) {
                    assertThat(hovered).as("offset %d", offset).isNull();
                } else {
                    assertThat(hovered).as("offset %d", offset).isNotNull();
                    assertThat(hovered.getKind()).as("offset %d", offset).isEqualTo(token.getKind());
                    assertThat(hovered.getStart()).as("offset %d", offset).isEqualTo(token.getStart());
                }
            }
        }
    }

    // ============ 全文分词 ============

    @Nested
    @DisplayName("tokenize")
    class Tokenize {

        @Test
        @DisplayName("注释、分节与食材")
        void testBasic() {
            List<ElementSpan> spans = MarkerScanner.tokenize(bytes("-- note\n=Section=\n@salt{1%tsp}"));
            assertThat(spans).extracting(ElementSpan::getKind)
                    .containsExactly(ElementKind.COMMENT, ElementKind.SECTION, ElementKind.INGREDIENT);
            assertThat(spans).extracting(ElementSpan::getStart).containsExactly(0, 8, 18);
            assertThat(spans).extracting(ElementSpan::length).containsExactly(7, 9, 12);
        }

        @Test
        @DisplayName("front matter 只标记分隔行")
        void testFrontMatter() {
            List<ElementSpan> spans = MarkerScanner.tokenize(bytes("---\ntitle: @not\n---\nUse #pan."));
            assertThat(spans).extracting(ElementSpan::getKind)
                    .containsExactly(ElementKind.METADATA, ElementKind.METADATA, ElementKind.COOKWARE);
            assertThat(spans.get(2).getText()).isEqualTo("#pan");
        }

        @Test
        @DisplayName("行内注释与块注释")
        void testInlineComments() {
            List<ElementSpan> spans = MarkerScanner.tokenize(bytes("Stir [- gently -] @sugar -- done"));
            assertThat(spans).extracting(ElementSpan::getKind)
                    .containsExactly(ElementKind.COMMENT, ElementKind.INGREDIENT, ElementKind.COMMENT);
            assertThat(spans.get(0).getText()).isEqualTo("[- gently -]");
            assertThat(spans.get(2).getText()).isEqualTo("-- done");
        }

        @Test
        @DisplayName("单独的标记不产生元素")
        void testLoneMarkers() {
            assertThat(MarkerScanner.tokenize(bytes("a @ b # c ~"))).isEmpty();
        }

        @Test
        @DisplayName("结果升序且互不重叠")
        void testOrdered() {
            String text = ">> servings: 4\n\nMix @flour{200%g} in #bowl{}, then ~{10%min}.\r\n= Bake =\n@eggs(beaten) -- x";
            List<ElementSpan> spans = MarkerScanner.tokenize(bytes(text));
            assertThat(spans).hasSize(7);
            for (int i = 1; i < spans.size(); i++) {
                assertThat(spans.get(i).getStart()).isGreaterThanOrEqualTo(spans.get(i - 1).getEnd());
            }
            assertThat(spans.get(5).getText()).isEqualTo("@eggs(beaten)");
        }
    }
}
