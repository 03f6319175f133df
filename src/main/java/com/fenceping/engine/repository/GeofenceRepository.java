package com.fenceping.engine.repository;

import com.fenceping.engine.entity.Geofence;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Read access to the geofences table.
 *
 * The engine never writes here; the CRUD system owns the rows.
 */
@Repository
public interface GeofenceRepository extends JpaRepository<Geofence, UUID> {

    /**
     * Active geofences of one account. Backed by the (account_id, is_active) index.
     */
    List<Geofence> findByAccountIdAndActiveTrue(UUID accountId);
}
