package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import server.core.EngineFacade;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

/** Runs an uploaded machine to completion: {@code {machineId, input, maxDepth?, maxTransitions?}}. */
@WebServlet(name = "StartRunServlet", urlPatterns = {"/api/runs"})
public class StartRunServlet extends ApiServlet {

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        EngineFacade.RunResult r;
        try {
            Map<String, Object> in = fields(req);
            String input = text(in, "input");
            r = facade().run(requireText(in, "machineId"), input == null ? "" : input, limits(in));
        } catch (IllegalArgumentException ex) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, ex.getMessage());
            return;
        }

        Map<String, Object> out = new LinkedHashMap<>();
        out.put("machineId", r.machineId());
        out.put("verdict", r.verdict());
        out.put("depth", r.depth());
        out.put("transitions", r.transitions());
        out.put("summary", r.summary());
        out.put("report", r.report());
        out.put("levels", r.levels());
        writeOk(resp, out);
    }
}
