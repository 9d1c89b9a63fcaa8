package org.abstractica.realtime.impl.transport;

import java.util.ArrayList;
import java.util.List;

/**
 * Transport factory handing out {@link FakeTransport}s.
 */
public class FakeTransportFactory implements TransportFactory
{
    private final List<FakeTransport> created = new ArrayList<>();

    @Override
    public Transport create(TransportOptions options, TransportListener listener)
    {
        FakeTransport transport = new FakeTransport(options, listener);
        created.add(transport);
        return transport;
    }

    public List<FakeTransport> getCreated()
    {
        return List.copyOf(created);
    }

    public int getCreatedCount()
    {
        return created.size();
    }

    /**
     * Returns the most recently created transport.
     *
     * @return the transport
     * @throws IllegalStateException if none was created
     */
    public FakeTransport last()
    {
        if (created.isEmpty())
        {
            throw new IllegalStateException("No transport created");
        }
        return created.get(created.size() - 1);
    }
}
