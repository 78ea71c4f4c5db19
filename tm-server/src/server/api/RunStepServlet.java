package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.*;
import java.io.IOException;

/** Expands one more level of a debug session. */
@WebServlet("/api/debug/step")
public class RunStepServlet extends ApiServlet {

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String runId;
        try {
            runId = requireText(fields(req), "runId");
        } catch (IllegalArgumentException ex) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, ex.getMessage());
            return;
        }
        writeOk(resp, toJson(facade().step(runId)));
    }
}
