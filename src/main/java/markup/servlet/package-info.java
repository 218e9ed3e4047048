// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * Sending rendered documents as Servlet API responses.
 * <p>
 * Only complete {@link markup.dom.Document}s can be sent, so that a response can't accidentally consist of a bare
 * element without the document type declaration.
 */
@ParametersAreNonnullByDefault
package markup.servlet;

import javax.annotation.ParametersAreNonnullByDefault;
