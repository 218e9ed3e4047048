// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Catalogs of standard HTML, SVG and MathML element names, with the element kind of each.
 */
@ParametersAreNonnullByDefault
package markup.dom.html;

import javax.annotation.ParametersAreNonnullByDefault;
