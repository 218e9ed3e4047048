// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.servlet;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import javax.servlet.http.HttpServletResponse;
import markup.dom.Document;
import markup.dom.RenderException;

/**
 * A utility class for writing rendered documents into servlet responses.
 */
public final class DocumentResponses {
    private DocumentResponses() {
    }

    /**
     * Renders the given document and sends it as the response.
     * <p>
     * On success, the response is {@code 200 OK} with an HTML body. If the document cannot be rendered, the response is
     * {@code 500 Internal Server Error} with a plain text body containing the render error message instead.
     * <p>
     * Any {@link IOException}s thrown while writing the response are allowed to propagate.
     */
    public static void send(final HttpServletResponse response, final Document document) throws IOException {
        final String html;
        try {
            html = document.renderToString();
        } catch (final RenderException e) {
            write(response, HttpServletResponse.SC_INTERNAL_SERVER_ERROR, plainTextContentType, e.getMessage());
            return;
        }
        write(response, HttpServletResponse.SC_OK, htmlContentType, html);
    }

    private static void write(
        final HttpServletResponse response,
        final int status,
        final String contentType,
        final String body
    ) throws IOException {
        final var bytes = body.getBytes(StandardCharsets.UTF_8);
        response.setStatus(status);
        response.setContentType(contentType);
        response.setContentLength(bytes.length);
        final var out = response.getOutputStream();
        out.write(bytes);
        out.flush();
    }

    /**
     * The content type of successfully rendered documents.
     */
    public static final String htmlContentType = "text/html; charset=utf-8";

    /**
     * The content type of render error responses.
     */
    public static final String plainTextContentType = "text/plain; charset=utf-8";
}
