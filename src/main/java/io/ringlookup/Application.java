package io.ringlookup;

import io.ringlookup.config.impl.LookupConfig;
import io.ringlookup.config.type.ConfigLoader;
import io.ringlookup.connection.impl.NettyConnectionPool;
import io.ringlookup.core.model.BrokerAddress;
import io.ringlookup.discovery.ServiceDiscovery;
import io.ringlookup.schedule.impl.ScheduledDelay;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;

/**
 * Command line entry point: resolves a topic (or every partition of one) and prints where it lives.
 */
@Slf4j
public class Application {
    public static void main(final String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar ring-lookup.jar <lookup-config.yaml> <topic> [--partitioned]");
            System.exit(1);
        }

        final LookupConfig cfg = ConfigLoader.load(args[0]);
        final String topic = args[1];
        final boolean partitioned = args.length > 2 && "--partitioned".equals(args[2]);

        log.info("Looking up {} via {}", topic, cfg.getServiceUrl());

        int status = 0;
        try (final NettyConnectionPool pool = new NettyConnectionPool(cfg);
             final ScheduledDelay delay = new ScheduledDelay()) {
            final ServiceDiscovery discovery = new ServiceDiscovery(pool, delay, cfg);

            if (partitioned) {
                final List<Map.Entry<String, BrokerAddress>> partitions = discovery.lookupPartitionedTopic(topic).get();
                partitions.forEach(e -> System.out.println(e.getKey() + " -> " + describe(e.getValue())));
            } else {
                System.out.println(topic + " -> " + describe(discovery.lookupTopic(topic).get()));
            }
        } catch (final ExecutionException e) {
            log.error("Lookup of {} failed: {}", topic, e.getCause().getMessage(), e.getCause());
            status = 2;
        }
        System.exit(status);
    }

    private static String describe(final BrokerAddress address) {
        return address.brokerUrl() + " via " + address.url() + (address.proxy() ? " (proxied)" : "");
    }
}
