package server.api;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import server.core.EngineFacade;
import server.core.Json;
import tmengine.RunLimits;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/** Shared plumbing of the JSON endpoints: facade lookup, request fields, response writing. */
abstract class ApiServlet extends HttpServlet {

    protected EngineFacade facade() {
        Object f = getServletContext().getAttribute("facade");
        if (f instanceof EngineFacade ef) return ef;
        throw new IllegalStateException("EngineFacade not initialized; check Bootstrap");
    }

    /** JSON bodies are parsed as an object; anything else is read from the request parameters. */
    protected static Map<String, Object> fields(HttpServletRequest req) throws IOException {
        String ct = req.getContentType();
        if (ct != null && ct.toLowerCase().contains("json")) {
            return Json.parseObject(req.getReader().lines().collect(Collectors.joining("\n")));
        }
        Map<String, Object> out = new LinkedHashMap<>();
        Map<String, String[]> params = req.getParameterMap();
        if (params != null) {
            for (Map.Entry<String, String[]> e : params.entrySet()) {
                String[] v = e.getValue();
                if (v != null && v.length > 0) out.put(e.getKey(), v[0]);
            }
        }
        return out;
    }

    protected static String text(Map<String, Object> fields, String key) {
        Object v = fields.get(key);
        return v == null ? null : String.valueOf(v);
    }

    protected static String requireText(Map<String, Object> fields, String key) {
        String v = text(fields, key);
        if (v == null || v.isBlank()) throw new IllegalArgumentException("Missing " + key);
        return v.trim();
    }

    /** Null when absent or blank. */
    protected static Integer optInt(Map<String, Object> fields, String key) {
        Object v = fields.get(key);
        if (v == null) return null;
        if (v instanceof Integer i) return i;
        if (v instanceof Number) throw new IllegalArgumentException(key + " must be a whole number, got " + v);
        String s = String.valueOf(v).trim();
        if (s.isEmpty()) return null;
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be a whole number, got '" + s + "'");
        }
    }

    protected static RunLimits limits(Map<String, Object> fields) {
        return RunLimits.of(optInt(fields, "maxDepth"), optInt(fields, "maxTransitions"));
    }

    protected static void writeOk(HttpServletResponse resp, Map<String, Object> body) throws IOException {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", true);
        out.putAll(body);
        prepare(resp);
        Json.write(resp.getWriter(), out);
    }

    protected static void writeError(HttpServletResponse resp, int status, String message) throws IOException {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("ok", false);
        out.put("error", message == null ? "Bad request" : message);
        prepare(resp);
        resp.setStatus(status);
        Json.write(resp.getWriter(), out);
    }

    protected static Map<String, Object> toJson(EngineFacade.DebugState st) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("runId", st.runId());
        out.put("level", st.level());
        out.put("transitions", st.transitions());
        out.put("width", st.width());
        out.put("halted", st.halted());
        if (st.verdict() != null) out.put("verdict", st.verdict());
        if (st.summary() != null) out.put("summary", st.summary());
        out.put("frontier", st.frontier());
        return out;
    }

    private static void prepare(HttpServletResponse resp) {
        resp.setCharacterEncoding("UTF-8");
        resp.setContentType("application/json; charset=UTF-8");
    }
}
