package com.taxitelemetry.fare.config;

import com.taxitelemetry.fare.entity.TripRecordEntity;
import org.hibernate.boot.model.naming.CamelCaseToUnderscoresNamingStrategy;
import org.hibernate.boot.model.naming.Identifier;
import org.hibernate.engine.jdbc.env.spi.JdbcEnvironment;

/**
 * Maps the trip record entity onto the configured table name. Everything else
 * keeps Spring Boot's default snake_case naming.
 */
public class TripTableNamingStrategy extends CamelCaseToUnderscoresNamingStrategy {

    private final String tableName;

    public TripTableNamingStrategy(String tableName) {
        this.tableName = tableName == null || tableName.isBlank() ? TripRecordEntity.DEFAULT_TABLE : tableName.trim();
    }

    @Override
    public Identifier toPhysicalTableName(Identifier logicalName, JdbcEnvironment jdbcEnvironment) {
        if (logicalName != null && TripRecordEntity.DEFAULT_TABLE.equalsIgnoreCase(logicalName.getText())) {
            return Identifier.toIdentifier(tableName);
        }
        return super.toPhysicalTableName(logicalName, jdbcEnvironment);
    }

    public String getTableName() {
        return tableName;
    }
}
