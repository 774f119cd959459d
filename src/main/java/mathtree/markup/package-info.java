// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The markup input model: an immutable element tree, and a reader producing one from markup text.
 */
@NonNullByDefault
package mathtree.markup;

import mathtree.util.annotation.NonNullByDefault;
