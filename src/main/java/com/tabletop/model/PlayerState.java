package com.tabletop.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Set;
import java.util.TreeSet;

/**
 * Per-match state of one player. Ids are stable integers starting at 0 in turn order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerState {

    private int id;

    private int position;

    private int balance;

    @Builder.Default
    private boolean active = true;

    @Builder.Default
    private Set<Integer> ownedPositions = new TreeSet<>();

    public boolean owns(int position) {
        return ownedPositions.contains(position);
    }

    public void deactivate() {
        this.active = false;
    }
}
