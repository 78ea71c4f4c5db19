package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.*;
import java.io.IOException;

@WebServlet("/api/debug/status")
public class RunStatusServlet extends ApiServlet {

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String runId = req.getParameter("runId");
        if (runId == null || runId.isBlank()) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "Missing runId");
            return;
        }
        writeOk(resp, toJson(facade().status(runId.trim())));
    }
}
