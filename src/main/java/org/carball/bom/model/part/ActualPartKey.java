package org.carball.bom.model.part;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Identity of a manufacturer part.
 */
public record ActualPartKey(
        @JsonProperty("manufacturer") String manufacturerName,
        @JsonProperty("manufacturer_part_name") String manufacturerPartName
) implements Comparable<ActualPartKey> {

    @Override
    public int compareTo(ActualPartKey other) {
        int result = manufacturerName.compareTo(other.manufacturerName);
        return result != 0 ? result : manufacturerPartName.compareTo(other.manufacturerPartName);
    }

    @Override
    public String toString() {
        return manufacturerName + " " + manufacturerPartName;
    }
}
