package com.tabletop.dto;

import com.tabletop.model.PropertyRecord;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Copy of a property record for presentation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PropertySnapshot {

    private int position;
    private String name;
    private int purchasePrice;
    private int rentPrice;
    private Integer ownerId;

    public static PropertySnapshot fromRecord(PropertyRecord record) {
        return PropertySnapshot.builder()
                .position(record.getPosition())
                .name(record.getName())
                .purchasePrice(record.getPurchasePrice())
                .rentPrice(record.getRentPrice())
                .ownerId(record.getOwnerId())
                .build();
    }
}
