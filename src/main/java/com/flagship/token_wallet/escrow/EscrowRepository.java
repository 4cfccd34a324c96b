package com.flagship.token_wallet.escrow;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface EscrowRepository extends JpaRepository<EscrowEntity, UUID> {

    Optional<EscrowEntity> findByBookingId(String bookingId);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM EscrowEntity e WHERE e.escrowId = :escrowId")
    Optional<EscrowEntity> findByIdForUpdate(@Param("escrowId") UUID escrowId);
}
