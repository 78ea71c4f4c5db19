package server.api;

import jakarta.servlet.annotation.WebServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import server.core.MachineInfo;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@WebServlet(name = "ListMachinesServlet", urlPatterns = {"/api/machines"})
public class ListMachinesServlet extends ApiServlet {

    @Override
    protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
        List<Map<String, Object>> out = new ArrayList<>();
        for (MachineInfo info : facade().machines()) out.add(UploadMachineServlet.toJson(info));
        writeOk(resp, Map.of("machines", out));
    }
}
