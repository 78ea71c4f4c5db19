package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import server.core.EngineFacade;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@WebServlet(name = "HistoryServlet", urlPatterns = {"/api/history"})
public class HistoryServlet extends ApiServlet {

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        List<Map<String, Object>> rows = new ArrayList<>();
        for (EngineFacade.HistoryRow h : facade().history()) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("runNo", h.runNo());
            m.put("machine", h.machine());
            m.put("input", h.input());
            m.put("maxDepth", h.maxDepth());
            m.put("maxTransitions", h.maxTransitions());
            m.put("verdict", h.verdict());
            m.put("depth", h.depth());
            m.put("transitions", h.transitions());
            m.put("summary", h.summary());
            rows.add(m);
        }
        writeOk(resp, Map.of("history", rows));
    }
}
