package com.example.battlearena.repository;

import com.example.battlearena.model.domain.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Coin and stat changes are single conditional UPDATEs so two concurrent requests can never
 * both spend the same balance.
 */
@Repository
public interface UserRepository extends JpaRepository<User, Long> {

    Optional<User> findByUsername(String username);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.coins = u.coins + :amount WHERE u.id = :userId")
    int addCoins(@Param("userId") Long userId, @Param("amount") long amount);

    /**
     * @return 1 if the balance covered the cost and was charged, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.coins = u.coins - :amount WHERE u.id = :userId AND u.coins >= :amount")
    int deductCoins(@Param("userId") Long userId, @Param("amount") long amount);

    /** Takes up to {@code amount}, never leaving a negative balance. */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.coins = CASE WHEN u.coins >= :amount THEN u.coins - :amount ELSE 0 END "
            + "WHERE u.id = :userId")
    int deductCoinsClamped(@Param("userId") Long userId, @Param("amount") long amount);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE User u SET u.progression.strength = u.progression.strength + :strength, "
            + "u.progression.vitality = u.progression.vitality + :vitality, "
            + "u.progression.statPoints = u.progression.statPoints - (:strength + :vitality) "
            + "WHERE u.id = :userId AND u.progression.statPoints >= (:strength + :vitality)")
    int allocateStats(@Param("userId") Long userId, @Param("strength") int strength,
            @Param("vitality") int vitality);
}
