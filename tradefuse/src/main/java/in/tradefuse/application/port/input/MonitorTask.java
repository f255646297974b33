package in.tradefuse.application.port.input;

import in.tradefuse.service.exit.MonitorReport;

/**
 * Timer-driven position monitoring unit of work.
 */
public interface MonitorTask {

    MonitorReport tick(InvocationContext ctx);
}
