package com.pushcast.dispatcher.repository;

import com.pushcast.dispatcher.model.DeviceToken;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Collection;
import java.util.List;

public interface DeviceTokenRepository extends JpaRepository<DeviceToken, String> {

    List<DeviceToken> findByUserIdIn(Collection<String> userIds);
}
