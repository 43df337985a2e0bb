package tech.yump.tenancy.tenant;

/**
 * Connection pool sizing for one tenant client.
 *
 * @param min minimum idle connections
 * @param max maximum pool size
 */
public record PoolConfig(int min, int max) {

    public static final PoolConfig DEFAULT = new PoolConfig(0, 5);

    public PoolConfig {
        if (min < 0 || max < 1 || min > max) {
            throw new IllegalArgumentException("Invalid pool config: min=" + min + ", max=" + max);
        }
    }
}
