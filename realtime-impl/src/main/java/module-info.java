/**
 * Realtime connection library implementation module.
 *
 * <p>Provides the default implementation of the realtime API.</p>
 */
module realtime.impl
{
    requires realtime.api;
    requires org.slf4j;
    requires java.net.http;
    requires com.fasterxml.jackson.databind;

    // Export factory implementations for external use
    exports org.abstractica.realtime.impl.client;
    exports org.abstractica.realtime.impl.loop;
    exports org.abstractica.realtime.impl.transport;

    // Export reporting for composition roots that forward to an error tracker
    exports org.abstractica.realtime.impl.error;
}
