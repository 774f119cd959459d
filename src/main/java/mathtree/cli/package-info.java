// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The command line front end: reads a markup file, parses it into a node chain and prints the chain's string
 * form.
 * <p>
 * Diagnostics from the parser go to standard error; an unreadable input aborts with a non-zero exit code.
 */
@NonNullByDefault
package mathtree.cli;

import mathtree.util.annotation.NonNullByDefault;
