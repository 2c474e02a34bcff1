package party.iroiro.r2oracle;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import party.iroiro.r2oracle.codecs.OracleType;

/**
 * Column descriptor: lower-cased label and native type
 */
@EqualsAndHashCode
@AllArgsConstructor
public class OracleColumn {
    private final String name;
    private final OracleType type;

    public String getName() {
        return name;
    }

    public OracleType getType() {
        return type;
    }

    @Override
    public String toString() {
        return name + " " + type;
    }
}
