package dustin.perp.domains.engine.port;

/**
 * 오라클 가격 (price, decimal)
 * Oracle price with its decimal count
 */
public final class OraclePrice {

    private final long price;
    private final int decimal;
    private final long publishedAtMs;

    public OraclePrice(long price, int decimal, long publishedAtMs) {
        if (price <= 0) {
            throw new IllegalArgumentException("Oracle price must be positive: " + price);
        }
        this.price = price;
        this.decimal = decimal;
        this.publishedAtMs = publishedAtMs;
    }

    public long getPrice() {
        return price;
    }

    public int getDecimal() {
        return decimal;
    }

    public long getPublishedAtMs() {
        return publishedAtMs;
    }

    @Override
    public String toString() {
        return price + "e-" + decimal;
    }
}
