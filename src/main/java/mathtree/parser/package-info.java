// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
/**
 * The markup parser, turning {@link mathtree.markup.MarkupNode} trees into presentation node chains.
 */
@NonNullByDefault
package mathtree.parser;

import mathtree.util.annotation.NonNullByDefault;
