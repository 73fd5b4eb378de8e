package com.hhplus.ordering.infrastructure.memory;

import com.hhplus.ordering.domain.entity.Order;
import com.hhplus.ordering.domain.entity.OrderSnapshot;
import com.hhplus.ordering.domain.repository.OrderRepository;
import com.hhplus.ordering.domain.vo.CartId;
import com.hhplus.ordering.domain.vo.OrderId;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 인메모리 주문 저장소
 *
 * 주문 스냅샷을 리스트(arena)에 순서대로 쌓고, orderId/cartId → 위치 인덱스로 찾습니다.
 * 객체 그래프를 그대로 들고 있지 않으므로 조회할 때마다 스냅샷에서 새 Order를 복원해 돌려줍니다.
 * 멱등성 이력(processedPaymentIds, processedReservationIds)도 스냅샷에 함께 저장됩니다.
 */
@Repository
public class InMemoryOrderRepository implements OrderRepository {

    private final List<OrderSnapshot> arena = new ArrayList<>();
    private final Map<OrderId, Integer> orderIndex = new HashMap<>();
    private final Map<CartId, Integer> cartIndex = new HashMap<>();

    @Override
    public synchronized void save(Order order) {
        OrderSnapshot snapshot = order.toSnapshot();

        Integer position = orderIndex.get(snapshot.id());
        if (position != null) {
            arena.set(position, snapshot);
            return;
        }

        arena.add(snapshot);
        int newPosition = arena.size() - 1;
        orderIndex.put(snapshot.id(), newPosition);
        cartIndex.putIfAbsent(snapshot.cartId(), newPosition);
    }

    @Override
    public synchronized Optional<Order> findById(OrderId id) {
        return Optional.ofNullable(orderIndex.get(id))
                .map(arena::get)
                .map(Order::reconstitute);
    }

    @Override
    public synchronized Optional<Order> findByCartId(CartId cartId) {
        return Optional.ofNullable(cartIndex.get(cartId))
                .map(arena::get)
                .map(Order::reconstitute);
    }

    public synchronized int count() {
        return arena.size();
    }
}
