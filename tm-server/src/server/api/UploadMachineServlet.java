package server.api;

import jakarta.servlet.ServletException;
import jakarta.servlet.annotation.MultipartConfig;
import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import jakarta.servlet.http.Part;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import server.core.MachineInfo;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Accepts a machine CSV as the raw request body or as the multipart part {@code file}. */
@WebServlet(name = "UploadMachineServlet", urlPatterns = {"/api/machines/upload"})
@MultipartConfig
public class UploadMachineServlet extends ApiServlet {

    private static final Logger log = LoggerFactory.getLogger(UploadMachineServlet.class);

    @Override
    protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws ServletException, IOException {
        String csv = readCsv(req);
        if (csv == null || csv.isBlank()) {
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, "Missing machine CSV");
            return;
        }
        try {
            MachineInfo info = facade().loadMachine(csv);
            writeOk(resp, Map.of("machine", toJson(info)));
        } catch (IllegalArgumentException ex) {
            log.debug("Rejected upload: {}", ex.getMessage());
            writeError(resp, HttpServletResponse.SC_BAD_REQUEST, ex.getMessage());
        }
    }

    static Map<String, Object> toJson(MachineInfo info) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("id", info.id());
        m.put("name", info.name());
        m.put("states", info.states());
        m.put("start", info.startState());
        m.put("accept", info.acceptState());
        m.put("reject", info.rejectState());
        m.put("transitions", info.transitions());
        return m;
    }

    private static String readCsv(HttpServletRequest req) throws IOException, ServletException {
        String ct = req.getContentType();
        if (ct != null && ct.toLowerCase().contains("multipart/")) {
            Part part = req.getPart("file");
            if (part == null) return null;
            try (InputStream in = part.getInputStream()) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
        }
        try (InputStream in = req.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }
}
