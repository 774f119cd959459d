// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * A small Common Lisp-style condition and restart system.
 * <p>
 * Parsing a document produces diagnostics that are not errors: the parser keeps going and the caller decides
 * whether, and how, to show them. Conditions model exactly that. Fatal conditions are reserved for failures the
 * caller must react to, and are delivered by unwinding to a {@link Restart}.
 */
@NonNullByDefault
package mathtree.util.condition;

import mathtree.util.annotation.NonNullByDefault;
