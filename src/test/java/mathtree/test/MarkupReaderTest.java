// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.test;

import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import mathtree.markup.MarkupNode;
import mathtree.markup.MarkupReadErrorCondition;
import mathtree.markup.MarkupReader;
import static org.assertj.core.api.Assertions.assertThat;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

final class MarkupReaderTest {
    @Test
    void whitespaceBetweenElementsIsDropped() {
        final var root = read("<m>\n  <v>x</v>\n  <n> 1 </n>\n</m>");
        assertThat(root.children()).hasSize(2);
        assertThat(root.hasElementChildren()).isTrue();
        final var number = (MarkupNode.Element) root.children().get(1);
        assertThat(number.content()).isEqualTo(" 1 ");
        assertThat(number.hasElementChildren()).isFalse();
    }

    @Test
    void attributesAreKept() {
        final var root = read("<cell type=\"code\" hide=\"true\"/>");
        assertThat(root.name()).isEqualTo("cell");
        assertThat(root.attributes()).containsOnlyKeys("type", "hide");
        assertThat(root.attribute("type")).isEqualTo("code");
        assertThat(root.attribute("missing")).isNull();
        assertThat(root.attribute("missing", "fallback")).isEqualTo("fallback");
    }

    @Test
    void deeplyNestedElementsAreRead() {
        final var levels = 20_000;
        final var root = read("<m>" + "<p>".repeat(levels) + "x" + "</p>".repeat(levels) + "<v>y</v></m>");
        assertThat(root.children()).hasSize(2);
        var element = (MarkupNode.Element) root.children().get(0);
        int depth = 1;
        while (element.hasElementChildren()) {
            assertThat(element.name()).isEqualTo("p");
            assertThat(element.children()).hasSize(1);
            element = (MarkupNode.Element) element.children().get(0);
            depth += 1;
        }
        assertThat(depth).isEqualTo(levels);
        assertThat(element.content()).isEqualTo("x");
        assertThat(((MarkupNode.Element) root.children().get(1)).content()).isEqualTo("y");
    }

    @Test
    void characterDataIsMerged() {
        final var root = read("<t>a<![CDATA[<b>]]>c &amp; d</t>");
        assertThat(root.content()).isEqualTo("a<b>c & d");
    }

    @Test
    void commentsAreDropped() {
        final var root = read("<m><!-- nothing --><v>x</v><?pi data?></m>");
        assertThat(root.children()).hasSize(1);
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "<m><v>x</m>",
        "",
        "just text",
        "<!DOCTYPE m [<!ENTITY e \"boom\">]><m>&e;</m>",
    })
    void badMarkupIsReported(final String markup) {
        try (final var recorder = new ConditionRecorder()) {
            assertThat(MarkupReader.read(markup)).isNull();
            assertThat(recorder.conditionsOfType(MarkupReadErrorCondition.class)).hasSize(1);
        }
    }

    @Test
    void elementsAreImmutableCopies() {
        final var children = new ArrayList<MarkupNode>();
        children.add(MarkupNode.text("a"));
        final var element = new MarkupNode.Element("v", Map.of(), children);
        children.add(MarkupNode.text("b"));
        assertThat(element.children()).hasSize(1);
        assertThat(element.content()).isEqualTo("a");
    }

    private static MarkupNode.Element read(final String markup) {
        return Objects.requireNonNull(MarkupReader.read(markup));
    }
}
