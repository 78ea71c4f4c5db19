package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import server.core.EngineFacade;

import java.io.IOException;
import java.util.Map;

@WebServlet(name = "DebugStartServlet", urlPatterns = {"/api/debug/start"})
public class DebugStartServlet extends ApiServlet {

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        EngineFacade.DebugState st;
        try {
            Map<String, Object> in = fields(req);
            String input = text(in, "input");
            st = facade().startDebug(requireText(in, "machineId"), input == null ? "" : input, limits(in));
        } catch (IllegalArgumentException ex) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, ex.getMessage());
            return;
        }
        writeOk(resp, toJson(st));
    }
}
