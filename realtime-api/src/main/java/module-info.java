/**
 * Realtime connection library API module.
 *
 * <p>Provides interfaces for subscribing to server-pushed domain events
 * and sending client events over a self-healing, authenticated connection.</p>
 */
module realtime.api
{
    requires org.slf4j;
    requires transitive com.fasterxml.jackson.databind;

    exports org.abstractica.realtime;
    exports org.abstractica.realtime.handlers;
}
