// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Miscellaneous utilities not specific to any part of the program.
 */
@ParametersAreNonnullByDefault
package markup.util;

import javax.annotation.ParametersAreNonnullByDefault;
