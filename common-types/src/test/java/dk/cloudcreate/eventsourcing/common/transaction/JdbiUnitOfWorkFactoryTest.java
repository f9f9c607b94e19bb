package dk.cloudcreate.eventsourcing.common.transaction;

import org.h2.jdbcx.JdbcDataSource;
import org.jdbi.v3.core.Jdbi;
import org.junit.jupiter.api.*;

import java.sql.SQLException;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.*;

@DisplayName("JdbiUnitOfWorkFactory")
class JdbiUnitOfWorkFactoryTest {
    private Jdbi                  jdbi;
    private JdbiUnitOfWorkFactory unitOfWorkFactory;

    @BeforeEach
    void setup() {
        var dataSource = new JdbcDataSource();
        dataSource.setURL("jdbc:h2:mem:uow_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1");
        jdbi = Jdbi.create(dataSource);
        jdbi.useHandle(handle -> handle.execute("CREATE TABLE orders (id VARCHAR(64) PRIMARY KEY)"));
        unitOfWorkFactory = new JdbiUnitOfWorkFactory(jdbi);
    }

    @Test
    void work_performed_inside_usingUnitOfWork_is_committed() {
        // When
        unitOfWorkFactory.usingUnitOfWork(unitOfWork -> unitOfWork.handle().execute("INSERT INTO orders (id) VALUES ('order-1')"));

        // Then
        assertThat(countOrders()).isEqualTo(1);
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
    }

    @Test
    void a_failure_inside_usingUnitOfWork_rolls_back_and_propagates_the_failure() {
        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWork.handle().execute("INSERT INTO orders (id) VALUES ('order-1')");
            throw new IllegalStateException("Business rule violated");
        })).isInstanceOf(IllegalStateException.class)
           .hasMessage("Business rule violated");

        // Then
        assertThat(countOrders()).isEqualTo(0);
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
    }

    @Test
    void a_nested_call_joins_the_outer_unit_of_work_and_only_the_outer_call_commits() {
        unitOfWorkFactory.usingUnitOfWork(outer -> {
            var innerUnitOfWork = unitOfWorkFactory.withUnitOfWork(inner -> {
                inner.handle().execute("INSERT INTO orders (id) VALUES ('order-1')");
                return inner;
            });
            assertThat(innerUnitOfWork).isSameAs(outer);
            assertThat(outer.status()).isEqualTo(UnitOfWorkStatus.Started);
        });

        assertThat(countOrders()).isEqualTo(1);
    }

    @Test
    void a_failing_nested_call_marks_the_outer_unit_of_work_as_rollback_only() {
        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(outer -> {
            outer.handle().execute("INSERT INTO orders (id) VALUES ('order-1')");
            try {
                unitOfWorkFactory.usingUnitOfWork(inner -> {
                    throw new IllegalArgumentException("inner failure");
                });
            } catch (IllegalArgumentException e) {
                assertThat(outer.status()).isEqualTo(UnitOfWorkStatus.MarkedForRollbackOnly);
            }
        })).isInstanceOf(UnitOfWorkException.class)
           .hasCauseInstanceOf(IllegalArgumentException.class);

        // Then
        assertThat(countOrders()).isEqualTo(0);
    }

    @Test
    void a_failed_commit_propagates_the_commit_failure_and_releases_the_unit_of_work() {
        // Given
        var unitOfWorkReference = new AtomicReference<HandleAwareUnitOfWork>();

        // When
        assertThatThrownBy(() -> unitOfWorkFactory.usingUnitOfWork(unitOfWork -> {
            unitOfWorkReference.set(unitOfWork);
            unitOfWork.handle().execute("INSERT INTO orders (id) VALUES ('order-1')");
            unitOfWork.handle().getConnection().close();
        })).isInstanceOf(UnitOfWorkException.class)
           .hasMessage("Failed to commit the UnitOfWork")
           .hasRootCauseInstanceOf(SQLException.class);

        // Then
        assertThat(unitOfWorkReference.get().status()).isEqualTo(UnitOfWorkStatus.RolledBack);
        assertThat(unitOfWorkReference.get().getCauseOfRollback()).isNotNull();
        assertThat(unitOfWorkFactory.getCurrentUnitOfWork()).isEmpty();
        assertThat(countOrders()).isEqualTo(0);
    }

    @Test
    void getRequiredUnitOfWork_fails_when_no_unit_of_work_is_active() {
        assertThatThrownBy(() -> unitOfWorkFactory.getRequiredUnitOfWork())
                .isInstanceOf(NoActiveUnitOfWorkException.class);
    }

    private int countOrders() {
        return jdbi.withHandle(handle -> handle.createQuery("SELECT COUNT(*) FROM orders")
                                               .mapTo(Integer.class)
                                               .one());
    }
}
