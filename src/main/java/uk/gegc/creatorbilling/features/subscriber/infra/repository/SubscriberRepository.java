package uk.gegc.creatorbilling.features.subscriber.infra.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.creatorbilling.features.subscriber.domain.model.Subscriber;

import java.util.UUID;

@Repository
public interface SubscriberRepository extends JpaRepository<Subscriber, UUID> {
}
