package com.example.battlearena.repository;

import com.example.battlearena.model.entity.OwnedWeapon;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OwnedWeaponRepository extends JpaRepository<OwnedWeapon, Long> {

    List<OwnedWeapon> findByOwnerIdOrderByAttackBonusDesc(Long ownerId);
}
