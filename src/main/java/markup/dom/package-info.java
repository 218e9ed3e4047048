// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later

/**
 * The element tree and its HTML serializer.
 * <p>
 * Trees are built from {@link markup.dom.Element}s and other {@link markup.dom.Content}, and turned into HTML text by
 * {@link markup.dom.Serializer}. Trees are immutable, so they can be shared freely between threads.
 */
@ParametersAreNonnullByDefault
package markup.dom;

import javax.annotation.ParametersAreNonnullByDefault;
