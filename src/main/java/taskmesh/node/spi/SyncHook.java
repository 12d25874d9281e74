package taskmesh.node.spi;

/**
 * Extra work run on every coordination tick after header expiry and result
 * flushing, e.g. P2P gossip, resource sync or a payment deadline sweep.
 */
public interface SyncHook {

    String name();

    void sync();

    static SyncHook of(String name, Runnable action) {
        return new SyncHook() {
            @Override
            public String name() {
                return name;
            }

            @Override
            public void sync() {
                action.run();
            }
        };
    }
}
