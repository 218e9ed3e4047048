// Copyright © 2021-2022  Fanael Linithien
// SPDX-License-Identifier: AGPL-3.0-or-later
package markup.servlet;

import java.io.IOException;
import javax.servlet.ServletException;
import javax.servlet.http.HttpServlet;
import javax.servlet.http.HttpServletRequest;
import javax.servlet.http.HttpServletResponse;
import markup.dom.Document;

/**
 * A servlet that responds to {@code GET} requests with a rendered HTML document.
 * <p>
 * Subclasses only build the document; rendering and writing the response is handled by
 * {@link DocumentResponses#send(HttpServletResponse, Document)}.
 */
public abstract class DocumentServlet extends HttpServlet {
    /**
     * Builds the document to send in response to the given request.
     */
    protected abstract Document document(HttpServletRequest request) throws ServletException, IOException;

    @Override
    protected final void doGet(final HttpServletRequest request, final HttpServletResponse response)
        throws ServletException, IOException {
        DocumentResponses.send(response, document(request));
    }

    private static final long serialVersionUID = 1L;
}
