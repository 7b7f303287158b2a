package space.maatini.transfer.group;

import space.maatini.transfer.service.ObjectStoreClient;

import java.util.Collection;

/**
 * Group of outstanding writes. Continuations run in the order the writes were started, so a caller
 * can record what was written in a fixed order.
 */
public class WriteGroup extends AsyncOpGroup {

    public WriteGroup() {
        super("write");
    }

    public void startPut(ObjectStoreClient client, String bucket, String key, byte[] data) {
        startPut(client, bucket, key, data, () -> { });
    }

    public void startPut(ObjectStoreClient client, String bucket, String key, byte[] data, Runnable onComplete) {
        addOperation(client.putAsync(bucket, key, data),
                String.format("put [%s] %s %d bytes", bucket, key, data.length), onComplete);
    }

    public void startDelete(ObjectStoreClient client, String bucket, Collection<String> keys) {
        startDelete(client, bucket, keys, () -> { });
    }

    public void startDelete(ObjectStoreClient client, String bucket, Collection<String> keys, Runnable onComplete) {
        addOperation(client.deleteAsync(bucket, keys),
                String.format("delete [%s] %d keys", bucket, keys.size()), onComplete);
    }
}
