// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.test;

import java.util.Map;
import java.util.Objects;
import mathtree.cell.Asset;
import mathtree.cell.Chain;
import mathtree.cell.DiffNode;
import mathtree.cell.EditorNode;
import mathtree.cell.FractionNode;
import mathtree.cell.FractionStyle;
import mathtree.cell.GroupNode;
import mathtree.cell.GroupType;
import mathtree.cell.ImageNode;
import mathtree.cell.MatrixNode;
import mathtree.cell.Node;
import mathtree.cell.NodeKind;
import mathtree.cell.ParenNode;
import mathtree.cell.PowerNode;
import mathtree.cell.SlideShowNode;
import mathtree.cell.TextNode;
import mathtree.cell.TextStyle;
import mathtree.markup.MarkupNode;
import mathtree.markup.MarkupReadErrorCondition;
import mathtree.markup.MarkupReader;
import mathtree.parser.AssetResolver;
import mathtree.parser.InvalidSettingCondition;
import mathtree.parser.LengthLimit;
import mathtree.parser.MathParser;
import mathtree.parser.NestingTooDeepCondition;
import mathtree.parser.ParserSettings;
import mathtree.parser.UnknownTagCondition;
import mathtree.util.annotation.Nullable;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

final class MathParserTest {
    @Test
    void fraction() {
        final var node = parse("<f><n>1</n><n>2</n></f>");
        assertThat(node).isInstanceOf(FractionNode.class);
        assertThat(Chain.toString(node)).isEqualTo("1/2");
        assertThat(((FractionNode) node).fractionStyle()).isEqualTo(FractionStyle.NORMAL);
    }

    @Test
    void compoundSlotsAreParenthesized() {
        assertThat(text("<f><r><v>a</v><t>+</t><v>b</v></r><n>2</n></f>")).isEqualTo("(a+b)/2");
        assertThat(text("<e><r><v>a</v><t>+</t><v>b</v></r><n>2</n></e>")).isEqualTo("(a+b)^2");
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "<f><n>1</n></f>",
        "<e><v>x</v></e>",
        "<i><v>x</v></i>",
        "<ie><v>x</v><n>1</n></ie>",
        "<fn><fnm>sin</fnm></fn>",
        "<d><v>x</v></d>",
        "<sm><n>1</n><n>2</n></sm>",
        "<in><n>0</n><n>1</n><v>x</v></in>",
        "<in def=\"false\"><v>x</v></in>",
        "<at><v>f</v></at>",
        "<lm><fnm>lim</fnm><v>x</v></lm>",
    })
    void missingChildrenProduceNothing(final String markup) {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(parse(markup)).isNull();
            final var warnings = recorder.conditionsOfType(UnknownTagCondition.class);
            assertThat(warnings).hasSize(1);
            assertThat(markup).startsWith("<" + warnings.get(0).tagName());
        }
    }

    @Test
    void extraChildrenAreIgnored() {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(text("<f><n>1</n><n>2</n><n>3</n></f>")).isEqualTo("1/2");
            assertThat(recorder.conditions()).isEmpty();
        }
    }

    @ParameterizedTest
    @CsvSource({
        "100, 100, 100",
        "100, 101, 30",
        "10, 11, 3",
        "5, 11, 3",
        "300, 301, 30",
    })
    void longNumbersAreElided(final int displayedDigits, final int length, final int kept) {
        final var parser = new MathParser(new ParserSettings(displayedDigits, LengthLimit.SHORT), AssetResolver.none());
        final var digits = digitString(length);
        final var node = (TextNode) Objects.requireNonNull(parser.parseLine("<m><n>" + digits + "</n></m>"));
        assertThat(node.value()).isEqualTo(digits);
        if (length <= parser.settings().displayedDigits()) {
            assertThat(node.displayedValue()).isEqualTo(digits);
        } else {
            assertThat(node.displayedValue()).isEqualTo(
                digits.substring(0, kept) + "[" + (length - 2 * kept) + " digits]"
                    + digits.substring(length - kept));
        }
    }

    @Test
    void minusIsDisplayedAsMinusSign() {
        final var node = (TextNode) Objects.requireNonNull(parse("<n>-1</n>"));
        assertThat(node.value()).isEqualTo("-1");
        assertThat(node.displayedValue()).isEqualTo("−1");
        assertThat(node.style()).isEqualTo(TextStyle.NUMBER);
        assertThat(node).asString().isEqualTo("-1");
    }

    @Test
    void controlCharactersAreReplaced() {
        final var node = parse("<v>a\u0001b</v>");
        assertThat(node).isNotNull();
        assertThat(node.value()).isEqualTo("a�b");
    }

    @Test
    void tooLongTextIsNotParsed() {
        final var markup = "<m>" + "x".repeat(LengthLimit.SHORT.ceiling()) + "</m>";
        final var node = new MathParser().parseLine(markup, NodeKind.PROMPT);
        assertThat(node).isInstanceOf(TextNode.class);
        assertThat(node.value()).isEqualTo(" << Expression too long to display! >>");
        assertThat(node.forceBreakLineHere()).isTrue();
        assertThat(node.kind()).isEqualTo(NodeKind.PROMPT);
        assertThat(node.next()).isNull();
    }

    @Test
    void deepNestingIsCutOff() {
        final var levels = 6900;
        final var markup = "<m>" + "<p>".repeat(levels) + "x" + "</p>".repeat(levels) + "<v>y</v></m>";
        assertThat(LengthLimit.SHORT.exceeds(markup.length())).isFalse();
        try (final var recorder = new ConditionRecorder()) {
            final var first = new MathParser().parseLine(markup);
            assertThat(first).isNotNull();
            var node = first;
            int depth = 0;
            while (node instanceof ParenNode paren) {
                depth += 1;
                node = paren.inner();
            }
            assertThat(depth).isEqualTo(MathParser.MAX_NESTING_DEPTH);
            assertThat(node).isInstanceOf(TextNode.class);
            assertThat(node.value()).isEqualTo(" << Expression nested too deeply to display! >>");
            assertThat(node.forceBreakLineHere()).isTrue();
            assertThat(first.next()).isNotNull();
            assertThat(first.next().value()).isEqualTo("y");
            assertThat(Chain.toString(first)).endsWith(")y");

            final var conditions = recorder.conditionsOfType(NestingTooDeepCondition.class);
            assertThat(conditions).hasSize(1);
            assertThat(conditions.get(0).tagName()).isEqualTo("p");
            assertThat(recorder.conditionsOfType(UnknownTagCondition.class)).isEmpty();
        }
    }

    @Test
    void nestingUpToTheLimitIsKept() {
        final var levels = MathParser.MAX_NESTING_DEPTH;
        try (final var recorder = new ConditionRecorder()) {
            final var first = new MathParser().parseLine(
                "<m>" + "<q>".repeat(levels) + "x" + "</q>".repeat(levels) + "</m>");
            assertThat(Chain.toString(first)).isEqualTo("sqrt(".repeat(levels) + "x" + ")".repeat(levels));
            assertThat(recorder.conditions()).isEmpty();
        }
    }

    @Test
    void textAtTheCeilingIsParsed() {
        final var filler = LengthLimit.SHORT.ceiling() - "<m></m>".length();
        final var node = new MathParser().parseLine("<m>" + "x".repeat(filler) + "</m>");
        assertThat(node).isNotNull();
        assertThat(node.value()).hasSize(filler);
    }

    @Test
    void unlimitedParsesAnything() {
        final var parser = new MathParser(new ParserSettings(100, LengthLimit.UNLIMITED), AssetResolver.none());
        final var node = parser.parseLine("<m>" + "x".repeat(LengthLimit.MEDIUM.ceiling()) + "</m>");
        assertThat(node).isNotNull();
        assertThat(node.value()).hasSize(LengthLimit.MEDIUM.ceiling());
    }

    @Test
    void unknownTagIsReportedOnce() {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(text("<v>a</v><zzz>x</zzz><v>b</v><yyy/>")).isEqualTo("ab");
            final var warnings = recorder.conditionsOfType(UnknownTagCondition.class);
            assertThat(warnings).hasSize(1);
            assertThat(warnings.get(0).tagName()).isEqualTo("zzz");
            assertThat(warnings.get(0).message()).contains("<zzz>");
        }
    }

    @Test
    void unknownTagWithElementsIsParsedFlat() {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(text("<zzz><v>a</v><v>b</v></zzz>")).isEqualTo("ab");
            assertThat(recorder.conditionsOfType(UnknownTagCondition.class)).hasSize(1);
        }
    }

    @Test
    void warningIsResetForEveryParse() {
        try (final var recorder = new ConditionRecorder()) {
            final var parser = new MathParser();
            parser.parseLine("<m><zzz/></m>");
            parser.parseLine("<m><zzz/></m>");
            assertThat(recorder.conditionsOfType(UnknownTagCondition.class)).hasSize(2);
        }
    }

    @Test
    void altCopyOverridesStringForm() {
        assertThat(text("<v altCopy=\"alpha\">α</v>")).isEqualTo("alpha");
        final var power = (PowerNode) Objects.requireNonNull(parse("<e altCopy=\"x squared\"><v>x</v><n>2</n></e>"));
        assertThat(power.isMatrixPower()).isFalse();
        assertThat(power).asString().isEqualTo("x squared");
    }

    @Test
    void highlightAppliesOnlyInside() {
        final var first = parse("<hl><v>x</v><f><n>1</n><n>2</n></f></hl><v>y</v>");
        final var nodes = Chain.toList(first);
        assertThat(nodes).hasSize(3);
        assertThat(nodes.get(0).isHighlighted()).isTrue();
        assertThat(nodes.get(1).isHighlighted()).isTrue();
        assertThat(nodes.get(2).isHighlighted()).isFalse();
    }

    @Test
    void derivativeStyleIsScopedToTheDifferential() {
        final var first = parse(
            "<d><f><s>d</s><r><s>d</s><v>x</v></r></f><v>y</v></d><f><n>1</n><n>2</n></f>");
        final var nodes = Chain.toList(first);
        assertThat(nodes).hasSize(2);
        final var diff = (DiffNode) nodes.get(0);
        assertThat(((FractionNode) Objects.requireNonNull(diff.differential())).fractionStyle())
            .isEqualTo(FractionStyle.DIFF);
        assertThat(((FractionNode) nodes.get(1)).fractionStyle()).isEqualTo(FractionStyle.NORMAL);
        assertThat(diff).asString().isEqualTo("'diff(y,x,1)");
    }

    @Test
    void higherDerivative() {
        assertThat(text(
            "<d><f diffstyle=\"yes\"><e><s>d</s><n>2</n></e><r><s>d</s><e><v>x</v><n>2</n></e></r></f><v>y</v></d>"))
            .isEqualTo("'diff(y,x,2)");
    }

    @Test
    void binomial() {
        final var node = (FractionNode) Objects.requireNonNull(parse("<f line=\"no\"><v>n</v><v>k</v></f>"));
        assertThat(node.fractionStyle()).isEqualTo(FractionStyle.CHOOSE);
        assertThat(node).asString().isEqualTo("binomial(n,k)");
    }

    @Test
    void sumsAndProducts() {
        assertThat(text("<sm><r><v>i</v><t>=</t><n>1</n></r><n>10</n><v>i</v></sm>"))
            .isEqualTo("sum(i,i,1,10)");
        assertThat(text("<sm type=\"prod\"><r><v>k</v><t>=</t><n>1</n></r><v>n</v><v>k</v></sm>"))
            .isEqualTo("product(k,k,1,n)");
        assertThat(text("<sm type=\"lsum\"><r><v>i</v><t>in</t><v>L</v></r><r/><v>i</v></sm>"))
            .isEqualTo("lsum(i,i,L)");
    }

    @Test
    void integrals() {
        assertThat(text("<in><n>0</n><n>1</n><v>x</v><r><s>d</s><v>x</v></r></in>"))
            .isEqualTo("integrate(x,x,0,1)");
        assertThat(text("<in def=\"false\"><v>f</v><r><s>d</s><v>t</v></r></in>"))
            .isEqualTo("integrate(f,t)");
    }

    @Test
    void limit() {
        assertThat(text("<lm><fnm>lim</fnm><r><v>x</v><t>-&gt;</t><n>0</n></r><v>f</v></lm>"))
            .isEqualTo("limit(f,x,0)");
    }

    @Test
    void powers() {
        final var power = (PowerNode) Objects.requireNonNull(parse("<e><v>x</v><n>2</n></e>"));
        assertThat(power.isMatrixPower()).isFalse();
        assertThat(power).asString().isEqualTo("x^2");
        assertThat(text("<e type=\"mat\"><v>A</v><n>2</n></e>")).isEqualTo("A^^2");
    }

    @Test
    void indices() {
        assertThat(text("<i><v>x</v><n>1</n></i>")).isEqualTo("x[1]");
        assertThat(text("<ie><v>x</v><n>1</n><n>2</n></ie>")).isEqualTo("x[1]^2");
    }

    @Test
    void functionsAndWrappers() {
        assertThat(text("<fn><fnm>sin</fnm><p><v>x</v></p></fn>")).isEqualTo("sin(x)");
        assertThat(text("<q><v>x</v><t>+</t><n>1</n></q>")).isEqualTo("sqrt(x+1)");
        assertThat(text("<a><v>x</v></a>")).isEqualTo("abs(x)");
        assertThat(text("<cj><v>z</v></cj>")).isEqualTo("conjugate(z)");
        assertThat(text("<at><v>f</v><r><v>x</v><t>=</t><n>0</n></r></at>")).isEqualTo("at(f,x=0)");
    }

    @Test
    void parenthesesWithAttributesAreNotPrinted() {
        final var paren = (ParenNode) Objects.requireNonNull(parse("<p print=\"no\"><v>x</v></p>"));
        assertThat(paren.isPrinted()).isFalse();
        assertThat(paren).asString().isEqualTo("x");
        assertThat(paren.breakUp()).isFalse();
    }

    @Test
    void matrixWithEntryWrappers() {
        try (final var recorder = new ConditionRecorder()) {
            final var matrix = (MatrixNode) Objects.requireNonNull(parse(
                "<tb special=\"true\"><mtr><mtd><n>1</n></mtd><mtd><n>2</n></mtd></mtr>"
                    + "<mtr><mtd><n>3</n></mtd></mtr></tb>"));
            assertThat(matrix.isSpecial()).isTrue();
            assertThat(matrix.rowCount()).isEqualTo(2);
            assertThat(matrix.columnCount()).isEqualTo(2);
            assertThat(matrix).asString().isEqualTo("matrix([1,2],[3,])");
            assertThat(recorder.conditions()).isEmpty();
        }
    }

    @Test
    void labelsForceLineBreaks() {
        final var first = parse("<lbl>(%o1) </lbl><n>1</n><lbl userdefined=\"yes\">(%o2) </lbl><n>2</n>");
        final var nodes = Chain.toList(first);
        assertThat(nodes.get(0).style()).isEqualTo(TextStyle.LABEL);
        assertThat(nodes.get(2).style()).isEqualTo(TextStyle.USER_LABEL);
        assertThat(nodes.get(2).forceBreakLineHere()).isTrue();
        assertThat(Chain.toString(first)).isEqualTo("(%o1) 1\n(%o2) 2");
    }

    @Test
    void mathLinesStartNewLines() {
        final var first = parse("<mth><v>a</v></mth><mth><v>b</v></mth>");
        assertThat(Chain.toString(first)).isEqualTo("a\nb");
        final var empty = parse("<mth/>");
        assertThat(empty).isNotNull();
        assertThat(empty).asString().isEqualTo(" ");
    }

    @Test
    void leafVariants() {
        final var error = parse("<t type=\"error\">oops</t>");
        assertThat(error).isNotNull();
        assertThat(error.kind()).isEqualTo(NodeKind.ERROR);
        assertThat(error.style()).isEqualTo(TextStyle.ERROR);

        final var hidden = parse("<h>*</h>");
        assertThat(hidden).isNotNull();
        assertThat(hidden.isHidden()).isTrue();

        assertThat(text("<ascii>65</ascii>")).isEqualTo("A");
        assertThat(text("<ascii>x65</ascii>")).isEqualTo("x65");
        assertThat(text("<v>a</v><mspace/><v>b</v>")).isEqualTo("a b");
        assertThat(Objects.requireNonNull(parse("<g>%pi</g>")).style()).isEqualTo(TextStyle.GREEK_CONSTANT);
        assertThat(Objects.requireNonNull(parse("<st>hi</st>")).style()).isEqualTo(TextStyle.STRING);
    }

    @Test
    void kindIsPropagatedIntoSlots() {
        final var fraction = (FractionNode) Objects.requireNonNull(
            new MathParser().parseLine("<m><f><n>1</n><n>2</n></f></m>", NodeKind.PROMPT));
        assertThat(fraction.kind()).isEqualTo(NodeKind.PROMPT);
        assertThat(Objects.requireNonNull(fraction.numerator()).kind()).isEqualTo(NodeKind.PROMPT);
    }

    @Test
    void parsedChainsStartUnbroken() {
        final var first = parse("<v>a</v><f><n>1</n><n>2</n></f><e><v>x</v><n>2</n></e>");
        assertThat(Chain.drawLength(first)).isEqualTo(Chain.length(first));
    }

    @Test
    void malformedMarkupIsReported() {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(new MathParser().parseLine("<m><v>x</m>")).isNull();
            assertThat(recorder.conditionsOfType(MarkupReadErrorCondition.class)).hasSize(1);
        }
    }

    @Test
    void editorTypes() {
        final var editor = (EditorNode) Objects.requireNonNull(
            parse("<editor type=\"section\"><line>a</line><line></line><line>b</line></editor>"));
        assertThat(editor.kind()).isEqualTo(NodeKind.SECTION);
        assertThat(editor.value()).isEqualTo("a\n\nb");
        assertThat(editor.kind().isComment()).isTrue();
        final var input = (EditorNode) Objects.requireNonNull(parse("<editor><line>x;</line></editor>"));
        assertThat(input.kind()).isEqualTo(NodeKind.INPUT);
        assertThat(input.kind().isComment()).isFalse();
    }

    @Test
    void codeCells() {
        final var groups = Chain.toList(document("""
            <cell type="code">
              <input><editor type="input"><line>x:1;</line></editor></input>
              <output><mth><lbl>(%o1) </lbl><n>1</n></mth></output>
            </cell>
            <cell type="code" hide="true">
              <input><editor type="input"><line>y:2;</line></editor></input>
              <output><mth><lbl>(%o2) </lbl><n>2</n></mth></output>
            </cell>
            """));
        assertThat(groups).hasSize(2);
        final var shown = (GroupNode) groups.get(0);
        assertThat(shown.type()).isEqualTo(GroupType.CODE);
        assertThat(shown.isOutputHidden()).isFalse();
        assertThat(shown).asString().isEqualTo("x:1;\n(%o1) 1");
        assertThat(Objects.requireNonNull(shown.editor()).kind()).isEqualTo(NodeKind.INPUT);
        for (final var node : Chain.nodes(shown.output())) {
            assertThat(node.group()).isSameAs(shown);
        }
        final var hidden = (GroupNode) groups.get(1);
        assertThat(hidden.isOutputHidden()).isTrue();
        assertThat(hidden).asString().isEqualTo("y:2;");
    }

    @ParameterizedTest
    @CsvSource({
        "title, 1, TITLE",
        "section, 2, SECTION",
        "subsection, 3, SUBSECTION",
        "subsection, 4, SUBSUBSECTION",
        "subsubsection, 4, SUBSUBSECTION",
    })
    void headings(final String type, final String level, final GroupType expected) {
        final var group = (GroupNode) Objects.requireNonNull(document(
            "<cell type=\"" + type + "\" sectioning_level=\"" + level + "\" hide=\"true\">"
                + "<editor type=\"" + type + "\"><line>Head</line></editor></cell>"));
        assertThat(group.type()).isEqualTo(expected);
        assertThat(group.isOutputHidden()).isFalse();
        assertThat(group).asString().isEqualTo("Head");
    }

    @Test
    void textAndPageBreakCells() {
        final var groups = Chain.toList(document(
            "<cell type=\"text\"><editor type=\"text\"><line>hello</line></editor></cell>"
                + "<cell type=\"pagebreak\"/>"));
        assertThat(groups).hasSize(2);
        assertThat(((GroupNode) groups.get(0)).type()).isEqualTo(GroupType.TEXT);
        assertThat(groups.get(0)).asString().isEqualTo("hello");
        assertThat(((GroupNode) groups.get(1)).type()).isEqualTo(GroupType.PAGEBREAK);
    }

    @Test
    void unknownCellTypeIsReported() {
        try (final var recorder = new ConditionRecorder()) {
            final var first = document("<cell type=\"zzz\"/><cell type=\"pagebreak\"/>");
            assertThat(Chain.length(first)).isEqualTo(1);
            final var warnings = recorder.conditionsOfType(UnknownTagCondition.class);
            assertThat(warnings).hasSize(1);
            assertThat(warnings.get(0).tagName()).isEqualTo("cell");
        }
    }

    @Test
    void imagesAreResolved() {
        final var plot = new Asset("plot.png", new byte[] {1, 2, 3}, 640, 480);
        final var assets = Map.of("plot.png", plot);
        final var parser = new MathParser(ParserSettings.defaults(), assets::get);
        final var root = Objects.requireNonNull(MarkupReader.read(
            "<wxMaximaDocument><cell type=\"image\"><editor type=\"text\"><line>caption</line></editor>"
                + "<img del=\"no\" rect=\"false\">plot.png</img></cell></wxMaximaDocument>"));
        final var group = (GroupNode) Objects.requireNonNull(parser.parseDocument(root));
        assertThat(group.type()).isEqualTo(GroupType.IMAGE);
        assertThat(Objects.requireNonNull(group.editor()).value()).isEqualTo("caption");
        final var image = (ImageNode) Objects.requireNonNull(group.output());
        assertThat(image.asset()).isSameAs(plot);
        assertThat(image.fileName()).isEqualTo("plot.png");
        assertThat(image.isTemporary()).isFalse();
        assertThat(image.drawsRectangle()).isFalse();

        final var missing = (ImageNode) Objects.requireNonNull(
            parser.parseElement(MarkupNode.element("img", MarkupNode.text("gone.png"))));
        assertThat(missing.asset()).isNull();
        assertThat(missing.isTemporary()).isTrue();
        assertThat(missing).asString().isEqualTo(" << Graphics >> ");
    }

    @Test
    void slideShows() {
        final var frame = new Asset("a.png", new byte[0], 10, 10);
        final var parser = new MathParser(ParserSettings.defaults(), name -> name.equals("a.png") ? frame : null);
        final var slides = (SlideShowNode) Objects.requireNonNull(
            parser.parseLine("<m><slide fr=\"5\">a.png; b.png;</slide></m>"));
        assertThat(slides.fileNames()).containsExactly("a.png", "b.png");
        assertThat(slides.frames()).containsExactly(frame, null);
        assertThat(slides.frameRate()).isEqualTo(5);
        assertThat(slides.frameCount()).isEqualTo(2);

        try (final var recorder = new ConditionRecorder()) {
            final var bad = (SlideShowNode) Objects.requireNonNull(
                parser.parseLine("<m><slide fr=\"fast\">a.png</slide></m>"));
            assertThat(bad.frameRate()).isEqualTo(2);
            final var conditions = recorder.conditionsOfType(InvalidSettingCondition.class);
            assertThat(conditions).hasSize(1);
            assertThat(conditions.get(0).key()).isEqualTo("fr");
        }
    }

    @Test
    void sequenceCanStopAfterFirst() {
        final var nodes = MarkupNode.element(
            "r",
            MarkupNode.element("v", MarkupNode.text("a")),
            MarkupNode.element("v", MarkupNode.text("b"))).children();
        final var parser = new MathParser();
        assertThat(Chain.toString(parser.parseSequence(nodes, false))).isEqualTo("a");
        assertThat(Chain.toString(parser.parseSequence(nodes, true))).isEqualTo("ab");
    }

    private static @Nullable Node parse(final String body) {
        return new MathParser().parseLine("<m>" + body + "</m>");
    }

    private static String text(final String body) {
        return Chain.toString(parse(body));
    }

    private static @Nullable Node document(final String cells) {
        final var root = Objects.requireNonNull(MarkupReader.read("<wxMaximaDocument>" + cells + "</wxMaximaDocument>"));
        return new MathParser().parseDocument(root);
    }

    private static String digitString(final int length) {
        final var builder = new StringBuilder(length);
        for (int i = 0; i < length; i += 1) {
            builder.append((char) ('0' + (i + 1) % 10));
        }
        return builder.toString();
    }
}
