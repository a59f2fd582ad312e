package io.cronlattice.cli;

import java.io.PrintStream;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import io.cronlattice.spi.DispatchException;
import io.cronlattice.spi.DispatchRequest;
import io.cronlattice.spi.Dispatcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes each dispatch request to stdout as a JSON line.
 */
public class LoggingDispatcher
        implements Dispatcher
{
    private static final Logger logger = LoggerFactory.getLogger(LoggingDispatcher.class);

    private final ObjectMapper mapper;
    private final PrintStream out;

    @Inject
    public LoggingDispatcher(ObjectMapper mapper, @StdOut PrintStream out)
    {
        this.mapper = mapper;
        this.out = out;
    }

    @Override
    public void dispatch(DispatchRequest request)
        throws DispatchException
    {
        String line;
        try {
            line = mapper.writeValueAsString(request);
        }
        catch (JsonProcessingException ex) {
            throw new DispatchException("Failed to serialize dispatch request of " + request.getJobName(), ex);
        }
        logger.debug("Dispatching {}", line);
        synchronized (out) {
            out.println(line);
            out.flush();
        }
    }
}
