package dk.trustworks.attribution.exceptions;

import jakarta.ws.rs.core.Response;
import jakarta.ws.rs.ext.ExceptionMapper;
import jakarta.ws.rs.ext.Provider;
import lombok.extern.jbosslog.JBossLog;

@JBossLog
@Provider
public class DataUnavailableExceptionMapper implements ExceptionMapper<DataUnavailableException> {

    @Override
    public Response toResponse(DataUnavailableException exception) {
        log.errorf(exception, "Attribution data unavailable: %s", exception.getMessage());
        return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                .entity(exception.getMessage())
                .build();
    }
}
