package com.staybot.db.mybatis;

import org.apache.ibatis.session.Configuration;
import org.apache.ibatis.session.SqlSession;
import org.apache.ibatis.session.SqlSessionFactory;
import org.apache.ibatis.session.SqlSessionFactoryBuilder;
import org.apache.ibatis.type.JdbcType;

import java.sql.Connection;

/**
 * Centralized MyBatis bootstrap for the tracked-item mappers.
 */
public final class MyBatisSupport {
    private static final SqlSessionFactory FACTORY = buildFactory();

    private MyBatisSupport() {
    }

    /**
     * Opens a session over a caller-owned connection. Set the connection's auto-commit
     * mode before calling; the session captures it at open time.
     */
    public static SqlSession openSession(Connection connection) {
        return FACTORY.openSession(connection);
    }

    private static SqlSessionFactory buildFactory() {
        Configuration config = new Configuration();
        config.setMapUnderscoreToCamelCase(true);
        config.setJdbcTypeForNull(JdbcType.NULL);

        config.addMapper(TrackedItemMapper.class);
        config.addMapper(PriceObservationMapper.class);
        config.addMapper(SearchRecordMapper.class);
        config.addMapper(NotificationRecordMapper.class);

        return new SqlSessionFactoryBuilder().build(config);
    }
}
