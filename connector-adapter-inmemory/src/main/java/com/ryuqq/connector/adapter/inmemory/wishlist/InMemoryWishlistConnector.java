package com.ryuqq.connector.adapter.inmemory.wishlist;

import com.ryuqq.connector.core.capability.WishlistConnector;
import com.ryuqq.connector.core.domain.wishlist.AddWishlistItemRequest;
import com.ryuqq.connector.core.domain.wishlist.Wishlist;
import com.ryuqq.connector.core.domain.wishlist.WishlistItem;
import com.ryuqq.connector.core.domain.wishlist.WishlistList;
import com.ryuqq.connector.core.exception.BackendCallException;
import com.ryuqq.connector.core.exception.ErrorCategory;
import com.ryuqq.connector.core.model.AdapterKind;
import com.ryuqq.connector.core.model.ConnectorConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * In-memory {@link WishlistConnector} reference implementation.
 *
 * <p>위시리스트는 프로세스 메모리에만 보관되며, 커넥터를 닫으면 모두 사라집니다.
 * 각 위시리스트의 변경은 {@link ConcurrentHashMap#compute}로 원자적으로 적용됩니다.</p>
 *
 * <p><strong>항목 추가 규칙:</strong> 같은 productId/variantId 항목이 이미 있으면
 * 새 항목을 만들지 않고 수량을 더합니다.</p>
 *
 * @author Connector Team
 * @since 1.0.0
 */
public class InMemoryWishlistConnector implements WishlistConnector {

    private static final Logger log = LoggerFactory.getLogger(InMemoryWishlistConnector.class);

    public static final AdapterKind KIND = AdapterKind.of("InMemoryWishlistAdapter");

    private static final String DEFAULT_NAME = "My Wishlist";

    private final Clock clock;
    private final ConcurrentHashMap<String, Wishlist> wishlists = new ConcurrentHashMap<>();
    private final AtomicLong wishlistSequence = new AtomicLong();
    private final AtomicLong itemSequence = new AtomicLong();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private volatile ConnectorConfig config;

    public InMemoryWishlistConnector() {
        this(Clock.systemUTC());
    }

    public InMemoryWishlistConnector(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    // ============================================================
    // Lifecycle
    // ============================================================

    @Override
    public String getDomain() {
        return DOMAIN;
    }

    @Override
    public AdapterKind getAdapterKind() {
        return KIND;
    }

    @Override
    public void initialize(ConnectorConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.config = config;
        log.info("Initialized in-memory wishlist connector: tenantId={}, storeId={}",
            config.tenantId(), config.storeId());
    }

    @Override
    public void healthCheck() {
        ensureOpen();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            log.info("Closing in-memory wishlist connector: wishlists={}", wishlists.size());
            wishlists.clear();
        }
    }

    @Override
    public Map<String, Long> stats() {
        long items = wishlists.values().stream().mapToLong(wishlist -> wishlist.items().size()).sum();
        return Map.of("wishlists", (long) wishlists.size(), "items", items);
    }

    // ============================================================
    // Wishlists
    // ============================================================

    @Override
    public WishlistList getWishlists(String customerId) {
        requireText(customerId, "customerId");
        ensureOpen();

        List<Wishlist> owned = wishlists.values().stream()
            .filter(wishlist -> customerId.equals(wishlist.customerId()))
            .sorted(Comparator.comparing(Wishlist::createdAt).thenComparing(Wishlist::id))
            .collect(Collectors.toList());
        return new WishlistList(owned, owned.size(), owned.size(), 0, false);
    }

    @Override
    public Wishlist getWishlist(String wishlistId) {
        requireText(wishlistId, "wishlistId");
        ensureOpen();

        Wishlist wishlist = wishlists.get(wishlistId);
        if (wishlist == null) {
            throw notFound("wishlist not found: " + wishlistId);
        }
        return wishlist;
    }

    @Override
    public Wishlist createWishlist(String customerId, String name, boolean isPublic) {
        requireText(customerId, "customerId");
        ensureOpen();

        Instant now = clock.instant();
        ConnectorConfig current = config;
        Wishlist wishlist = new Wishlist(
            "wl-" + wishlistSequence.incrementAndGet(),
            customerId,
            current == null ? null : current.tenantId(),
            current == null ? null : current.storeId(),
            name == null || name.isBlank() ? DEFAULT_NAME : name,
            List.of(),
            isPublic,
            now,
            now
        );
        wishlists.put(wishlist.id(), wishlist);
        log.debug("Created wishlist: id={}, customerId={}", wishlist.id(), customerId);
        return wishlist;
    }

    @Override
    public void deleteWishlist(String wishlistId) {
        requireText(wishlistId, "wishlistId");
        ensureOpen();

        if (wishlists.remove(wishlistId) == null) {
            throw notFound("wishlist not found: " + wishlistId);
        }
    }

    // ============================================================
    // Items
    // ============================================================

    @Override
    public WishlistItem addItem(String wishlistId, AddWishlistItemRequest request) {
        requireText(wishlistId, "wishlistId");
        if (request == null) {
            throw new IllegalArgumentException("request cannot be null");
        }
        ensureOpen();

        AtomicReference<WishlistItem> added = new AtomicReference<>();
        Wishlist updated = wishlists.computeIfPresent(wishlistId, (id, wishlist) -> {
            Instant now = clock.instant();
            List<WishlistItem> items = new ArrayList<>(wishlist.items());
            for (int i = 0; i < items.size(); i++) {
                WishlistItem existing = items.get(i);
                if (sameProduct(existing, request)) {
                    added.set(withQuantityAndNotes(existing, existing.quantity() + request.quantity(),
                        request.notes() == null ? existing.notes() : request.notes()));
                    items.set(i, added.get());
                    return withItems(wishlist, items, now);
                }
            }
            added.set(new WishlistItem(
                "item-" + itemSequence.incrementAndGet(),
                request.productId(),
                request.variantId(),
                null,
                null,
                null,
                null,
                request.notes(),
                request.quantity(),
                now,
                Map.of()
            ));
            items.add(added.get());
            return withItems(wishlist, items, now);
        });

        if (updated == null) {
            throw notFound("wishlist not found: " + wishlistId);
        }
        return added.get();
    }

    @Override
    public void removeItem(String wishlistId, String itemId) {
        requireText(wishlistId, "wishlistId");
        requireText(itemId, "itemId");
        ensureOpen();

        AtomicBoolean removed = new AtomicBoolean();
        Wishlist updated = wishlists.computeIfPresent(wishlistId, (id, wishlist) -> {
            List<WishlistItem> items = new ArrayList<>(wishlist.items());
            removed.set(items.removeIf(item -> itemId.equals(item.id())));
            return removed.get() ? withItems(wishlist, items, clock.instant()) : wishlist;
        });

        if (updated == null) {
            throw notFound("wishlist not found: " + wishlistId);
        }
        if (!removed.get()) {
            throw notFound("wishlist item not found: " + itemId);
        }
    }

    @Override
    public WishlistItem updateItem(String wishlistId, String itemId, int quantity, String notes) {
        requireText(wishlistId, "wishlistId");
        requireText(itemId, "itemId");
        if (quantity <= 0) {
            throw new IllegalArgumentException("quantity must be positive (current: " + quantity + ")");
        }
        ensureOpen();

        AtomicReference<WishlistItem> changed = new AtomicReference<>();
        Wishlist updated = wishlists.computeIfPresent(wishlistId, (id, wishlist) -> {
            List<WishlistItem> items = new ArrayList<>(wishlist.items());
            for (int i = 0; i < items.size(); i++) {
                if (itemId.equals(items.get(i).id())) {
                    changed.set(withQuantityAndNotes(items.get(i), quantity, notes));
                    items.set(i, changed.get());
                    return withItems(wishlist, items, clock.instant());
                }
            }
            return wishlist;
        });

        if (updated == null) {
            throw notFound("wishlist not found: " + wishlistId);
        }
        if (changed.get() == null) {
            throw notFound("wishlist item not found: " + itemId);
        }
        return changed.get();
    }

    // ============================================================
    // Helpers
    // ============================================================

    private static boolean sameProduct(WishlistItem item, AddWishlistItemRequest request) {
        if (!item.productId().equals(request.productId())) {
            return false;
        }
        return item.variantId() == null
            ? request.variantId() == null
            : item.variantId().equals(request.variantId());
    }

    private static WishlistItem withQuantityAndNotes(WishlistItem item, int quantity, String notes) {
        return new WishlistItem(item.id(), item.productId(), item.variantId(), item.sku(), item.name(),
            item.price(), item.imageUrl(), notes, quantity, item.addedAt(), item.metadata());
    }

    private static Wishlist withItems(Wishlist wishlist, List<WishlistItem> items, Instant updatedAt) {
        return new Wishlist(wishlist.id(), wishlist.customerId(), wishlist.tenantId(), wishlist.storeId(),
            wishlist.name(), items, wishlist.isPublic(), wishlist.createdAt(), updatedAt);
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("wishlist connector is closed");
        }
    }

    private static BackendCallException notFound(String message) {
        return new BackendCallException(message, 404, ErrorCategory.NOT_FOUND, false, null);
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " cannot be null or blank");
        }
    }
}
