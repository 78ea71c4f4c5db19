package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.*;
import java.io.IOException;

/** Ends a debug session and frees its tree. Answers with the last snapshot, marked halted. */
@WebServlet(name = "DebugStopServlet", urlPatterns = {"/api/debug/stop"})
public class DebugStopServlet extends ApiServlet {

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String runId;
        try {
            runId = requireText(fields(req), "runId");
        } catch (IllegalArgumentException ex) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, ex.getMessage());
            return;
        }
        writeOk(resp, toJson(facade().stop(runId)));
    }
}
