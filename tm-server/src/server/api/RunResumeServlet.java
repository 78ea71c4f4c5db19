package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.*;
import java.io.IOException;

/** Steps a debug session until it halts. */
@WebServlet(name = "RunResumeServlet", urlPatterns = {"/api/debug/resume"})
public class RunResumeServlet extends ApiServlet {

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        String runId;
        try {
            runId = requireText(fields(req), "runId");
        } catch (IllegalArgumentException ex) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, ex.getMessage());
            return;
        }
        writeOk(resp, toJson(facade().resume(runId)));
    }
}
