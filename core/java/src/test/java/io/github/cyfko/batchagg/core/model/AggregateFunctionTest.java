package io.github.cyfko.batchagg.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AggregateFunction")
class AggregateFunctionTest {

    @Test
    @DisplayName("Operation names map to functions")
    void operationNames() {
        assertEquals(Optional.of(AggregateFunction.COUNT), AggregateFunction.fromOperationName("count"));
        assertEquals(Optional.of(AggregateFunction.AVERAGE), AggregateFunction.fromOperationName("average"));
        assertEquals(Optional.empty(), AggregateFunction.fromOperationName("where"));
        assertEquals(Optional.empty(), AggregateFunction.fromOperationName(null));
    }

    @Test
    @DisplayName("Both deferred spellings are recognized")
    void asyncNames() {
        assertEquals(Optional.of(AggregateFunction.SUM), AggregateFunction.fromAsyncName("async_sum"));
        assertEquals(Optional.of(AggregateFunction.MAXIMUM), AggregateFunction.fromAsyncName("asyncMaximum"));
        assertEquals(Optional.empty(), AggregateFunction.fromAsyncName("async_where"));
        assertEquals(Optional.empty(), AggregateFunction.fromAsyncName("asynchronous"));
        assertEquals(Optional.empty(), AggregateFunction.fromAsyncName("count"));
    }
}
