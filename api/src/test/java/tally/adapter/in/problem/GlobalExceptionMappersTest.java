package tally.adapter.in.problem;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import jakarta.ws.rs.container.ContainerRequestContext;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import tally.core.model.common.LedgerReadException;
import tally.core.model.common.LedgerWriteException;

@DisplayName("GlobalExceptionMappers")
class GlobalExceptionMappersTest {

    private GlobalExceptionMappers mappers;
    private ContainerRequestContext ctx;

    @BeforeEach
    void setUp() {
        mappers = new GlobalExceptionMappers();
        ctx = mock(ContainerRequestContext.class);
        when(ctx.getProperty(RequestIds.PROPERTY)).thenReturn("req-1");
    }

    @Test
    @DisplayName("should map ledger read failures to 503")
    void shouldMapLedgerReadFailure() {
        var response = mappers.mapLedgerReadException(new LedgerReadException("Timed out reading ledger"), ctx);

        assertEquals(503, response.getStatus());
        var body = (ErrorResponse) response.getEntity();
        assertEquals("Usage ledger unavailable", body.error());
        assertEquals("Timed out reading ledger", body.message());
        assertEquals("req-1", body.requestId());
    }

    @Test
    @DisplayName("should map ledger write failures to 503")
    void shouldMapLedgerWriteFailure() {
        var response = mappers.mapLedgerWriteException(new LedgerWriteException("write failed"), ctx);

        assertEquals(503, response.getStatus());
    }
}
