// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package mathtree.cell;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;

/**
 * An image resolved by an external asset resolver: its bytes and its size in pixels.
 */
@SuppressWarnings("ArrayRecordComponent")
@SuppressFBWarnings(
    value = {"EI_EXPOSE_REP", "EI_EXPOSE_REP2", "EQ_UNUSUAL"},
    justification = "Image bytes are shared with the resolver, never copied or mutated"
)
public record Asset(String name, byte[] data, int width, int height) {
}
