package server.api;

import jakarta.servlet.ServletContextEvent;
import jakarta.servlet.ServletContextListener;
import jakarta.servlet.annotation.WebListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import server.core.EngineFacade;
import server.core.EngineFacadeImpl;
import server.core.MachineStore;
import server.core.RunManager;

@WebListener
public class Bootstrap implements ServletContextListener {

    private static final Logger log = LoggerFactory.getLogger(Bootstrap.class);

    @Override
    public void contextInitialized(ServletContextEvent sce) {
        EngineFacade facade = new EngineFacadeImpl(MachineStore.get(), new RunManager());

        // one facade for every servlet
        sce.getServletContext().setAttribute("facade", facade);
        log.info("EngineFacade registered under key 'facade'");
    }

    @Override
    public void contextDestroyed(ServletContextEvent sce) {
        sce.getServletContext().removeAttribute("facade");
        log.info("EngineFacade released");
    }
}
