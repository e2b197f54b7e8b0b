package com.example.battlearena.repository;

import com.example.battlearena.model.entity.OwnedCollectible;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OwnedCollectibleRepository extends JpaRepository<OwnedCollectible, Long> {

    List<OwnedCollectible> findByOwnerIdOrderByAcquiredAtAsc(Long ownerId);
}
