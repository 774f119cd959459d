// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

/**
 * The text style a renderer picks fonts and colors by.
 */
public enum TextStyle {
    DEFAULT,
    VARIABLE,
    NUMBER,
    FUNCTION,
    SPECIAL_CONSTANT,
    GREEK_CONSTANT,
    STRING,
    INPUT,
    MAIN_PROMPT,
    OTHER_PROMPT,
    LABEL,
    USER_LABEL,
    HIGHLIGHT,
    WARNING,
    ERROR,
    TEXT,
    SUBSUBSECTION,
    SUBSECTION,
    SECTION,
    TITLE
}
