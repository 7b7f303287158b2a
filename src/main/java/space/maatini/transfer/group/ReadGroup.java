package space.maatini.transfer.group;

import space.maatini.transfer.service.ObjectStoreClient;

import java.util.Set;

/**
 * Group of outstanding reads.
 */
public class ReadGroup extends AsyncOpGroup {

    public ReadGroup() {
        super("read");
    }

    /**
     * Start a ranged read into {@code destination} and register it.
     */
    public void startGet(ObjectStoreClient client, String bucket, String key, long start, long size,
            byte[] destination, Runnable onComplete) {
        addOperation(client.getAsync(bucket, key, start, size, destination),
                String.format("get [%s] %s %d+%d", bucket, key, start, size), onComplete);
    }

    /**
     * Start listing {@code prefix} into {@code into} and register it.
     */
    public void startList(ObjectStoreClient client, String bucket, String prefix, Set<String> into,
            Runnable onComplete) {
        addOperation(client.listAsync(bucket, prefix, into).replaceWithVoid(),
                String.format("list [%s] %s", bucket, prefix), onComplete);
    }
}
