module io.github.cyfko.batchagg.core {
    requires jakarta.persistence;
    requires java.logging;

    exports io.github.cyfko.batchagg.core;
    exports io.github.cyfko.batchagg.core.api;
    exports io.github.cyfko.batchagg.core.cache;
    exports io.github.cyfko.batchagg.core.config;
    exports io.github.cyfko.batchagg.core.exception;
    exports io.github.cyfko.batchagg.core.model;
    exports io.github.cyfko.batchagg.core.relation;
    exports io.github.cyfko.batchagg.core.spi;
}
