package com.fenceping.engine.service;

import com.fenceping.engine.entity.Device;
import com.fenceping.engine.repository.DeviceRepository;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the owning account of a device for samples that arrive without one.
 *
 * Device ownership does not change at stream speed, so resolved accounts are cached;
 * unknown devices are not cached so a device registered later is picked up.
 */
@Service
@Slf4j
public class DeviceDirectory {

    private final DeviceRepository deviceRepository;
    private final Cache<String, String> accounts = Caffeine.newBuilder()
        .expireAfterWrite(Duration.ofMinutes(30))
        .maximumSize(500_000)
        .build();

    public DeviceDirectory(DeviceRepository deviceRepository) {
        this.deviceRepository = deviceRepository;
    }

    /**
     * OK with the account id, or an empty Optional when the device is unknown;
     * RETRYABLE when the registry cannot be read.
     */
    public Outcome<Optional<String>> accountOf(String deviceId) {
        String cached = accounts.getIfPresent(deviceId);
        if (cached != null) {
            return Outcome.ok(Optional.of(cached));
        }

        UUID id;
        try {
            id = UUID.fromString(deviceId);
        } catch (IllegalArgumentException e) {
            return Outcome.ok(Optional.empty());
        }

        try {
            Optional<String> account = deviceRepository.findById(id)
                .map(Device::getAccountId)
                .map(UUID::toString);
            account.ifPresent(a -> accounts.put(deviceId, a));
            return Outcome.ok(account);
        } catch (DataAccessException | TransactionException e) {
            log.warn("Device registry lookup failed for device {}", deviceId, e);
            return Outcome.retryable("Device registry unavailable", e);
        }
    }
}
