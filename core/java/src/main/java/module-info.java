module io.github.cyfko.binexp.core {
    requires java.logging;

    exports io.github.cyfko.binexp.core;
    exports io.github.cyfko.binexp.core.api;
    exports io.github.cyfko.binexp.core.config;
    exports io.github.cyfko.binexp.core.exception;
    exports io.github.cyfko.binexp.core.impl;
    exports io.github.cyfko.binexp.core.parsing;
    exports io.github.cyfko.binexp.core.rewrite;
    exports io.github.cyfko.binexp.core.utils;
}
