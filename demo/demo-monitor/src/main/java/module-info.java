/**
 * Demo monitor module.
 *
 * <p>Connects to a realtime server and prints domain events as they arrive.</p>
 */
module demo.monitor
{
    requires realtime.api;
    requires realtime.impl;
    requires org.slf4j;
    requires com.fasterxml.jackson.databind;
}
