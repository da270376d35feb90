package com.tabletop.dto;

import com.tabletop.model.CombatRecord;
import com.tabletop.model.PlayerState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Copy of a player's state for presentation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerSnapshot {

    private int id;
    /** Null when the token is hidden from the observer. */
    private Integer position;
    private boolean hidden;
    private int balance;
    private boolean active;
    private List<Integer> ownedPositions;
    /** Null when combat is not part of the match. */
    private Integer health;
    private Integer maxHealth;
    private boolean currentTurn;

    public static PlayerSnapshot fromPlayer(PlayerState player, CombatRecord combat) {
        return PlayerSnapshot.builder()
                .id(player.getId())
                .position(player.getPosition())
                .balance(player.getBalance())
                .active(player.isActive())
                .ownedPositions(List.copyOf(player.getOwnedPositions()))
                .health(combat != null ? combat.getHealth() : null)
                .maxHealth(combat != null ? combat.getMaxHealth() : null)
                .build();
    }
}
