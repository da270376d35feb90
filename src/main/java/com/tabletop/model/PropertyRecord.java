package com.tabletop.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A purchasable space on the board.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertyRecord {

    private int position;

    private String name;

    private int purchasePrice;

    private int rentPrice;

    /** Null while unowned. */
    private Integer ownerId;

    public boolean isOwned() {
        return ownerId != null;
    }

    public boolean isOwnedBy(int playerId) {
        return ownerId != null && ownerId == playerId;
    }

    public void release() {
        this.ownerId = null;
    }
}
