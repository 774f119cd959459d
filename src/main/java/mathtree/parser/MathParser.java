// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import mathtree.cell.AbsNode;
import mathtree.cell.Asset;
import mathtree.cell.AtNode;
import mathtree.cell.ChainBuilder;
import mathtree.cell.ConjugateNode;
import mathtree.cell.DiffNode;
import mathtree.cell.EditorNode;
import mathtree.cell.FractionNode;
import mathtree.cell.FractionStyle;
import mathtree.cell.FunctionNode;
import mathtree.cell.GroupNode;
import mathtree.cell.GroupType;
import mathtree.cell.ImageNode;
import mathtree.cell.IntegralNode;
import mathtree.cell.LimitNode;
import mathtree.cell.MatrixNode;
import mathtree.cell.Node;
import mathtree.cell.NodeKind;
import mathtree.cell.ParenNode;
import mathtree.cell.PowerNode;
import mathtree.cell.RootNode;
import mathtree.cell.SlideShowNode;
import mathtree.cell.SubSupNode;
import mathtree.cell.SubscriptNode;
import mathtree.cell.SumNode;
import mathtree.cell.SumStyle;
import mathtree.cell.TextNode;
import mathtree.cell.TextStyle;
import mathtree.markup.MarkupNode;
import mathtree.markup.MarkupReader;
import mathtree.util.Trace;
import mathtree.util.annotation.Nullable;
import mathtree.util.condition.ConditionContext;

/**
 * The markup parser: the primary means of converting markup trees into presentation node chains.
 * <p>
 * Every element is dispatched on its tag name. Elements that need a fixed number of children produce nothing when
 * given fewer; extra children are ignored. Elements that produce nothing are skipped, and the first of them in a
 * parse is reported with a non-fatal {@link UnknownTagCondition}.
 * <p>
 * Instances keep per-parse state, so an instance must not be used by several threads at once.
 */
public final class MathParser {
    /**
     * Initializes a parser with the default settings and no access to images.
     */
    public MathParser() {
        this(ParserSettings.defaults(), AssetResolver.none());
    }

    /**
     * Initializes a parser with the given settings, resolving images with {@code assetResolver}.
     */
    public MathParser(final ParserSettings settings, final AssetResolver assetResolver) {
        this.settings = settings;
        this.assetResolver = assetResolver;
    }

    public ParserSettings settings() {
        return settings;
    }

    /**
     * Parses a markup text fragment, such as a piece of computer algebra output, into a chain of nodes of the
     * default kind.
     *
     * @see #parseLine(String, NodeKind)
     */
    public @Nullable Node parseLine(final String markup) {
        return parseLine(markup, NodeKind.DEFAULT);
    }

    /**
     * Parses a markup text fragment into a chain of nodes, giving them the kind {@code kind}. The root element
     * only groups the content: its children are parsed.
     * <p>
     * Text longer than the configured {@link LengthLimit} isn't read at all, and yields a single placeholder
     * starting a new line. Control characters are replaced with U+FFFD before the text is read. Elements nested
     * deeper than {@link #MAX_NESTING_DEPTH} are replaced with a similar placeholder, see
     * {@link NestingTooDeepCondition}.
     * <p>
     * Signals a non-fatal {@link mathtree.markup.MarkupReadErrorCondition} and returns {@code null} if the text
     * isn't well-formed.
     */
    public @Nullable Node parseLine(final String markup, final NodeKind kind) {
        beginParse(kind);
        if (settings.lengthLimit().exceeds(markup.length())) {
            return placeholder(TOO_LONG_PLACEHOLDER);
        }
        final var root = MarkupReader.read(replaceControlCharacters(markup, true));
        if (root == null) {
            return null;
        }
        return sequence(root.children(), true);
    }

    /**
     * Parses a whole worksheet: the children of {@code root} become a chain of groups.
     */
    public @Nullable Node parseDocument(final MarkupNode.Element root) {
        beginParse(NodeKind.DEFAULT);
        try (final var trace = new Trace(() -> "Parsing document <" + root.name() + ">")) {
            trace.use();
            return sequence(root.children(), true);
        }
    }

    /**
     * Parses a list of sibling markup nodes.
     *
     * @param wantAll if true, every sibling is parsed and the results are chained; if false, only the first one
     *                is.
     */
    public @Nullable Node parseSequence(final List<? extends MarkupNode> nodes, final boolean wantAll) {
        beginParse(NodeKind.DEFAULT);
        return sequence(nodes, wantAll);
    }

    /**
     * Parses a single markup element.
     */
    public @Nullable Node parseElement(final MarkupNode.Element element) {
        beginParse(NodeKind.DEFAULT);
        return sequence(List.of(element), false);
    }

    private void beginParse(final NodeKind kind) {
        parserKind = kind;
        fractionStyle = FractionStyle.NORMAL;
        highlight = false;
        warned = false;
        depth = 0;
        depthReported = false;
    }

    private @Nullable Node sequence(final List<? extends MarkupNode> nodes, final boolean wantAll) {
        final var builder = new ChainBuilder();
        for (final var markup : nodes) {
            final var node = dispatch(markup);
            if (node != null) {
                builder.append(node);
            } else if (wantAll && markup instanceof MarkupNode.Element element) {
                warnOnce(element.name());
            }
            if (!wantAll) {
                break;
            }
        }
        return builder.build();
    }

    private @Nullable Node sequenceFrom(final List<MarkupNode> nodes, final int start) {
        return sequence(nodes.subList(start, nodes.size()), true);
    }

    private @Nullable Node single(final MarkupNode markup) {
        return sequence(List.of(markup), false);
    }

    private @Nullable Node dispatch(final MarkupNode markup) {
        if (markup instanceof MarkupNode.Text text) {
            return leaf(text.text(), TextStyle.DEFAULT);
        }
        final var element = (MarkupNode.Element) markup;
        if (depth >= MAX_NESTING_DEPTH) {
            if (!depthReported) {
                depthReported = true;
                ConditionContext.signal(new NestingTooDeepCondition(element.name(), MAX_NESTING_DEPTH));
            }
            return placeholder(TOO_DEEP_PLACEHOLDER);
        }
        depth += 1;
        try (final var trace = new Trace(() -> "Parsing markup element <" + element.name() + ">")) {
            trace.use();
            final var constructor = constructors.get(element.name());
            final @Nullable Node node;
            if (constructor != null) {
                node = constructor.construct(this, element);
            } else {
                warnOnce(element.name());
                node = element.hasElementChildren() ? sequence(element.children(), true) : null;
            }
            final var altCopy = element.attribute(ALT_COPY_ATTRIBUTE);
            if (node != null && altCopy != null) {
                node.setAltCopyText(altCopy);
            }
            return node;
        } finally {
            depth -= 1;
        }
    }

    private TextNode placeholder(final String text) {
        final var node = new TextNode(text);
        node.setKind(parserKind);
        node.forceBreakLine(true);
        return node;
    }

    private void warnOnce(final String tagName) {
        if (!warned) {
            warned = true;
            ConditionContext.signal(new UnknownTagCondition(tagName));
        }
    }

    private <T extends Node> T decorate(final T node) {
        node.setKind(parserKind);
        node.setStyle(TextStyle.VARIABLE);
        node.setHighlight(highlight);
        return node;
    }

    private TextNode leaf(final String text, final TextStyle style) {
        final var value = replaceControlCharacters(text, false);
        final var node = new TextNode(value, style);
        var displayed = value.replace('-', MINUS_SIGN);
        if (style == TextStyle.NUMBER) {
            displayed = elideDigits(displayed, settings.displayedDigits());
        }
        node.setDisplayedValue(displayed);
        node.setKind((style == TextStyle.ERROR) ? NodeKind.ERROR : parserKind);
        node.setHighlight(highlight);
        return node;
    }

    private @Nullable Node parseText(final MarkupNode.Element element, final TextStyle style) {
        return leaf(element.content(), style);
    }

    private @Nullable Node parseOtherText(final MarkupNode.Element element) {
        final var style = "error".equals(element.attribute("type")) ? TextStyle.ERROR : TextStyle.DEFAULT;
        return leaf(element.content(), style);
    }

    private @Nullable Node parseHiddenText(final MarkupNode.Element element) {
        final var node = leaf(element.content(), TextStyle.DEFAULT);
        node.setHidden(true);
        return node;
    }

    private @Nullable Node parseLabel(final MarkupNode.Element element) {
        final var userDefined = "yes".equals(element.attribute("userdefined", "no"));
        final var node = leaf(element.content(), userDefined ? TextStyle.USER_LABEL : TextStyle.LABEL);
        node.forceBreakLine(true);
        return node;
    }

    private @Nullable Node parseSpace(final MarkupNode.Element element) {
        return leaf(" ", TextStyle.DEFAULT);
    }

    private @Nullable Node parseCharCode(final MarkupNode.Element element) {
        return leaf(decodeCharCode(element.content()), TextStyle.DEFAULT);
    }

    private @Nullable Node parseFraction(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 2) {
            return null;
        }
        var style = fractionStyle;
        if ("no".equals(element.attribute("line"))) {
            style = FractionStyle.CHOOSE;
        }
        if ("yes".equals(element.attribute("diffstyle"))) {
            style = FractionStyle.DIFF;
        }
        return decorate(new FractionNode(single(children.get(0)), single(children.get(1)), style));
    }

    private @Nullable Node parseDiff(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 2) {
            return null;
        }
        final @Nullable Node differential;
        final var savedStyle = fractionStyle;
        fractionStyle = FractionStyle.DIFF;
        try {
            differential = single(children.get(0));
        } finally {
            fractionStyle = savedStyle;
        }
        return decorate(new DiffNode(differential, sequenceFrom(children, 1)));
    }

    private @Nullable Node parsePower(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 2) {
            return null;
        }
        final var power = new PowerNode(single(children.get(0)), single(children.get(1)));
        power.setMatrixPower(hasPresentationAttributes(element));
        return decorate(power);
    }

    private @Nullable Node parseSubscript(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 2) {
            return null;
        }
        return decorate(new SubscriptNode(single(children.get(0)), single(children.get(1))));
    }

    private @Nullable Node parseSubSup(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 3) {
            return null;
        }
        return decorate(new SubSupNode(single(children.get(0)), single(children.get(1)), single(children.get(2))));
    }

    private @Nullable Node parseAt(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 2) {
            return null;
        }
        return decorate(new AtNode(single(children.get(0)), single(children.get(1))));
    }

    private @Nullable Node parseFunction(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 2) {
            return null;
        }
        return decorate(new FunctionNode(single(children.get(0)), single(children.get(1))));
    }

    private @Nullable Node parseRoot(final MarkupNode.Element element) {
        return decorate(new RootNode(sequence(element.children(), true)));
    }

    private @Nullable Node parseAbs(final MarkupNode.Element element) {
        return decorate(new AbsNode(sequence(element.children(), true)));
    }

    private @Nullable Node parseConjugate(final MarkupNode.Element element) {
        return decorate(new ConjugateNode(sequence(element.children(), true)));
    }

    private @Nullable Node parseParen(final MarkupNode.Element element) {
        final var printed = !hasPresentationAttributes(element);
        return decorate(new ParenNode(sequence(element.children(), true), printed));
    }

    private @Nullable Node parseLimit(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 3) {
            return null;
        }
        return decorate(new LimitNode(single(children.get(0)), single(children.get(1)), single(children.get(2))));
    }

    private @Nullable Node parseSum(final MarkupNode.Element element) {
        final var children = element.children();
        if (children.size() < 3) {
            return null;
        }
        final var type = element.attribute("type", "sum");
        if (type.equals("lsum")) {
            return decorate(SumNode.lowerSum(single(children.get(0)), single(children.get(2))));
        }
        final var style = type.equals("prod") ? SumStyle.PRODUCT : SumStyle.SUM;
        return decorate(
            new SumNode(style, single(children.get(0)), single(children.get(1)), single(children.get(2))));
    }

    private @Nullable Node parseIntegral(final MarkupNode.Element element) {
        final var children = element.children();
        if (!hasPresentationAttributes(element)) {
            if (children.size() < 4) {
                return null;
            }
            return decorate(IntegralNode.definite(
                single(children.get(0)),
                single(children.get(1)),
                single(children.get(2)),
                sequenceFrom(children, 3)));
        }
        if (children.size() < 2) {
            return null;
        }
        return decorate(IntegralNode.indefinite(single(children.get(0)), sequenceFrom(children, 1)));
    }

    private @Nullable Node parseRow(final MarkupNode.Element element) {
        return sequence(element.children(), true);
    }

    private @Nullable Node parseTable(final MarkupNode.Element element) {
        final var matrix = new MatrixNode();
        if ("true".equals(element.attribute("special", "false"))) {
            matrix.setSpecial(true);
        }
        if ("true".equals(element.attribute("inference", "false"))) {
            matrix.setInference(true);
        }
        if ("true".equals(element.attribute("colnames", "false"))) {
            matrix.setColumnNames(true);
        }
        if ("true".equals(element.attribute("rownames", "false"))) {
            matrix.setRowNames(true);
        }
        // Decorated first: entries the matrix fills in itself take its kind.
        decorate(matrix);
        for (final var row : element.children()) {
            matrix.newRow();
            if (row instanceof MarkupNode.Element rowElement) {
                for (final var entry : rowElement.children()) {
                    if (entry instanceof MarkupNode.Element cell && cell.name().equals(MATRIX_ENTRY_TAG)) {
                        matrix.addEntry(sequence(cell.children(), true));
                    } else {
                        matrix.addEntry(single(entry));
                    }
                }
            }
        }
        matrix.setDimension();
        return matrix;
    }

    private @Nullable Node parseForcedLine(final MarkupNode.Element element) {
        final var node = sequence(element.children(), true);
        if (node == null) {
            return new TextNode(" ");
        }
        node.forceBreakLine(true);
        return node;
    }

    private @Nullable Node parseHighlight(final MarkupNode.Element element) {
        final var saved = highlight;
        highlight = true;
        try {
            return sequence(element.children(), true);
        } finally {
            highlight = saved;
        }
    }

    private @Nullable Node parseImage(final MarkupNode.Element element) {
        final var fileName = element.content().strip();
        final var temporary = !"no".equals(element.attribute("del", "yes"));
        final var image = new ImageNode(fileName, assetResolver.resolve(fileName), temporary);
        if ("false".equals(element.attribute("rect", "true"))) {
            image.setDrawRectangle(false);
        }
        return image;
    }

    private @Nullable Node parseSlideShow(final MarkupNode.Element element) {
        final var fileNames = new ArrayList<String>();
        for (final var token : element.content().split(";")) {
            final var fileName = token.strip();
            if (!fileName.isEmpty()) {
                fileNames.add(fileName);
            }
        }
        final var frames = new ArrayList<@Nullable Asset>(fileNames.size());
        for (final var fileName : fileNames) {
            frames.add(assetResolver.resolve(fileName));
        }
        final var slideShow = new SlideShowNode(fileNames, frames);
        final var frameRate = element.attribute("fr");
        if (frameRate != null) {
            try {
                slideShow.setFrameRate(Integer.parseInt(frameRate.strip()));
            } catch (final NumberFormatException e) {
                ConditionContext.signal(new InvalidSettingCondition("fr", frameRate));
            }
        }
        return slideShow;
    }

    private @Nullable Node parseEditorElement(final MarkupNode.Element element) {
        return parseEditor(element);
    }

    private EditorNode parseEditor(final MarkupNode.Element element) {
        final var editor = new EditorNode();
        switch (element.attribute("type", "input")) {
            case "text" -> setEditorKind(editor, NodeKind.TEXT, TextStyle.TEXT);
            case "title" -> setEditorKind(editor, NodeKind.TITLE, TextStyle.TITLE);
            case "section" -> setEditorKind(editor, NodeKind.SECTION, TextStyle.SECTION);
            case "subsection" -> setEditorKind(editor, NodeKind.SUBSECTION, TextStyle.SUBSECTION);
            case "subsubsection" -> setEditorKind(editor, NodeKind.SUBSUBSECTION, TextStyle.SUBSUBSECTION);
            default -> setEditorKind(editor, NodeKind.INPUT, TextStyle.INPUT);
        }
        final var lines = new ArrayList<String>();
        for (final var child : element.children()) {
            if (child instanceof MarkupNode.Element line && line.name().equals("line")) {
                lines.add(line.content());
            }
        }
        editor.setValue(String.join("\n", lines));
        return editor;
    }

    private static void setEditorKind(final EditorNode editor, final NodeKind kind, final TextStyle style) {
        editor.setKind(kind);
        editor.setStyle(style);
    }

    private @Nullable Node parseCell(final MarkupNode.Element element) {
        final var hide = "true".equals(element.attribute("hide", "false"));
        final var type = element.attribute("type", "text");
        final GroupNode group;
        switch (type) {
            case "code" -> {
                group = new GroupNode(GroupType.CODE);
                for (final var child : element.children()) {
                    if (child instanceof MarkupNode.Element part) {
                        if (part.name().equals("input")) {
                            group.setEditableContent(valueOf(sequence(part.children(), true)));
                        } else if (part.name().equals("output")) {
                            group.appendOutput(sequence(part.children(), true));
                        }
                    }
                }
            }
            case "image" -> {
                group = new GroupNode(GroupType.IMAGE);
                for (final var child : element.children()) {
                    if (child instanceof MarkupNode.Element part && part.name().equals("editor")) {
                        group.setEditableContent(parseEditor(part).value());
                    } else {
                        group.appendOutput(single(child));
                    }
                }
            }
            case "pagebreak" -> group = new GroupNode(GroupType.PAGEBREAK);
            case "text" -> {
                group = new GroupNode(GroupType.TEXT);
                group.setEditableContent(valueOf(sequence(element.children(), true)));
            }
            default -> {
                final var headingType = headingType(type, element.attribute("sectioning_level", "0"));
                if (headingType == null) {
                    return null;
                }
                group = new GroupNode(headingType);
                parseHeadingParts(group, element);
            }
        }
        group.setOutputHidden(hide);
        return group;
    }

    private void parseHeadingParts(final GroupNode group, final MarkupNode.Element element) {
        for (final var child : element.children()) {
            if (!(child instanceof MarkupNode.Element part)) {
                continue;
            }
            if (part.name().equals("editor")) {
                group.setEditableContent(parseEditor(part).value());
            } else if (part.name().equals("fold")) {
                try (final var trace = new Trace("Parsing folded groups")) {
                    trace.use();
                    final var folded = new ChainBuilder();
                    for (final var foldedGroup : part.children()) {
                        folded.append(single(foldedGroup));
                    }
                    group.hideTree(folded.build());
                }
            }
        }
    }

    private static @Nullable GroupType headingType(final String type, final String sectioningLevel) {
        return switch (type) {
            case "title" -> GroupType.TITLE;
            case "section" -> GroupType.SECTION;
            // Subsubsections are stored as subsections with a sectioning level of 4, which older readers show as
            // plain subsections. Level 0 means the file predates sectioning levels.
            case "subsection" -> sectioningLevel.equals("4") ? GroupType.SUBSUBSECTION : GroupType.SUBSECTION;
            case "subsubsection" -> GroupType.SUBSUBSECTION;
            default -> null;
        };
    }

    private static String valueOf(final @Nullable Node node) {
        return (node == null) ? "" : node.value();
    }

    private static boolean hasPresentationAttributes(final MarkupNode.Element element) {
        for (final var name : element.attributes().keySet()) {
            if (!name.equals(ALT_COPY_ATTRIBUTE)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Turns a decimal code point into its character. Anything else is returned unchanged.
     */
    static String decodeCharCode(final String text) {
        final var digits = text.strip();
        if (digits.isEmpty() || digits.length() > MAX_CODE_POINT_DIGITS
            || !digits.chars().allMatch(c -> c >= '0' && c <= '9')) {
            return text;
        }
        final var codePoint = Integer.parseInt(digits);
        return Character.isValidCodePoint(codePoint) ? Character.toString(codePoint) : text;
    }

    /**
     * Shortens a number longer than {@code displayedDigits} to its first and last few digits around a count of
     * the digits left out.
     */
    static String elideDigits(final String digits, final int displayedDigits) {
        final var length = digits.length();
        if (length <= displayedDigits) {
            return digits;
        }
        final var kept = Math.min(displayedDigits / 3, MAX_KEPT_DIGITS);
        return digits.substring(0, kept)
            + "[" + (length - 2 * kept) + " digits]"
            + digits.substring(length - kept);
    }

    /**
     * Replaces control characters with U+FFFD. Markup whitespace survives if {@code keepWhitespace} is set.
     */
    static String replaceControlCharacters(final String text, final boolean keepWhitespace) {
        @Nullable StringBuilder builder = null;
        for (int i = 0; i < text.length(); i += 1) {
            final var c = text.charAt(i);
            final var isMarkupWhitespace = c == '\n' || c == '\r' || c == '\t';
            if (Character.isISOControl(c) && !(keepWhitespace && isMarkupWhitespace)) {
                if (builder == null) {
                    builder = new StringBuilder(text.length());
                    builder.append(text, 0, i);
                }
                builder.append(REPLACEMENT_CHARACTER);
            } else if (builder != null) {
                builder.append(c);
            }
        }
        return (builder == null) ? text : builder.toString();
    }

    /**
     * The deepest element nesting the parser descends into. Every level costs a few stack frames here and in
     * every recursive walk over the resulting node tree.
     */
    public static final int MAX_NESTING_DEPTH = 256;

    static final String TOO_LONG_PLACEHOLDER = " << Expression too long to display! >>";
    static final String TOO_DEEP_PLACEHOLDER = " << Expression nested too deeply to display! >>";

    private static final String ALT_COPY_ATTRIBUTE = "altCopy";
    private static final String MATRIX_ENTRY_TAG = "mtd";
    private static final char MINUS_SIGN = '−';
    private static final char REPLACEMENT_CHARACTER = '�';
    private static final int MAX_KEPT_DIGITS = 30;
    private static final int MAX_CODE_POINT_DIGITS = 7;

    private static final Map<String, TagConstructor> constructors = Map.ofEntries(
        Map.entry("v", (parser, element) -> parser.parseText(element, TextStyle.VARIABLE)),
        Map.entry("t", MathParser::parseOtherText),
        Map.entry("n", (parser, element) -> parser.parseText(element, TextStyle.NUMBER)),
        Map.entry("h", MathParser::parseHiddenText),
        Map.entry("g", (parser, element) -> parser.parseText(element, TextStyle.GREEK_CONSTANT)),
        Map.entry("s", (parser, element) -> parser.parseText(element, TextStyle.SPECIAL_CONSTANT)),
        Map.entry("fnm", (parser, element) -> parser.parseText(element, TextStyle.FUNCTION)),
        Map.entry("st", (parser, element) -> parser.parseText(element, TextStyle.STRING)),
        Map.entry("lbl", MathParser::parseLabel),
        Map.entry("mspace", MathParser::parseSpace),
        Map.entry("ascii", MathParser::parseCharCode),
        Map.entry("p", MathParser::parseParen),
        Map.entry("f", MathParser::parseFraction),
        Map.entry("e", MathParser::parsePower),
        Map.entry("i", MathParser::parseSubscript),
        Map.entry("ie", MathParser::parseSubSup),
        Map.entry("fn", MathParser::parseFunction),
        Map.entry("q", MathParser::parseRoot),
        Map.entry("d", MathParser::parseDiff),
        Map.entry("sm", MathParser::parseSum),
        Map.entry("in", MathParser::parseIntegral),
        Map.entry("at", MathParser::parseAt),
        Map.entry("a", MathParser::parseAbs),
        Map.entry("cj", MathParser::parseConjugate),
        Map.entry("lm", MathParser::parseLimit),
        Map.entry("r", MathParser::parseRow),
        Map.entry("tb", MathParser::parseTable),
        Map.entry("mth", MathParser::parseForcedLine),
        Map.entry("line", MathParser::parseForcedLine),
        Map.entry("hl", MathParser::parseHighlight),
        Map.entry("img", MathParser::parseImage),
        Map.entry("slide", MathParser::parseSlideShow),
        Map.entry("editor", MathParser::parseEditorElement),
        Map.entry("cell", MathParser::parseCell)
    );

    private final ParserSettings settings;
    private final AssetResolver assetResolver;
    private NodeKind parserKind = NodeKind.DEFAULT;
    private FractionStyle fractionStyle = FractionStyle.NORMAL;
    private boolean highlight = false;
    private boolean warned = false;
    private int depth = 0;
    private boolean depthReported = false;

    @FunctionalInterface
    private interface TagConstructor {
        @Nullable Node construct(MathParser parser, MarkupNode.Element element);
    }
}
