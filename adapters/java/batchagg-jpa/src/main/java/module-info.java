module io.github.cyfko.batchagg.jpa {
    requires io.github.cyfko.batchagg.core;
    requires jakarta.persistence;
    requires java.logging;

    exports io.github.cyfko.batchagg.jpa;
    exports io.github.cyfko.batchagg.jpa.annotations;
    exports io.github.cyfko.batchagg.jpa.query;
    exports io.github.cyfko.batchagg.jpa.relation;
    exports io.github.cyfko.batchagg.jpa.scope;
    exports io.github.cyfko.batchagg.jpa.utils;
}
