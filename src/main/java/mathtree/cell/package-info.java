// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The presentation tree: the {@link mathtree.cell.Node} abstraction, its closed family of variants, and the
 * helpers that link nodes into content-order and draw-order chains.
 * <p>
 * Every node owns its content-order successor. Draw-order links and group back-references are plain references
 * that never imply ownership: the draw order coincides with the content order until a layout pass breaks a
 * composite up into fragments.
 */
@NonNullByDefault
package mathtree.cell;

import mathtree.util.annotation.NonNullByDefault;
