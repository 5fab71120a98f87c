package alertmigrator.translate;

import alertmigrator.model.ExecErrState;
import alertmigrator.model.NoDataState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps legacy no-data and execution-error policies to unified rule states.
 *
 * <p>Both translations are total: unknown legacy values are logged and mapped
 * to a fixed default, they never fail the migration of an alert.
 *
 * <p>"Keep last state" cannot be represented in the unified model. It maps to
 * {@link NoDataState#NO_DATA} and {@link ExecErrState#ERROR}, for which the
 * unified engine raises the dedicated {@code DatasourceNoData} and
 * {@code DatasourceError} alerts instead of firing the rule itself; see
 * {@link alertmigrator.silence.SilenceSynthesizer} for how those are muted.
 */
public final class StateTranslator {

    private static final Logger log = LoggerFactory.getLogger(StateTranslator.class);

    public static final String NO_DATA = "no_data";
    public static final String ALERTING = "alerting";
    public static final String KEEP_STATE = "keep_state";
    public static final String OK = "ok";

    private StateTranslator() {}

    /**
     * Translates a legacy no-data policy.
     *
     * @param legacy the legacy value, may be empty
     * @return the unified no-data state, {@link NoDataState#NO_DATA} for unknown values
     */
    public static NoDataState translateNoData(String legacy) {
        String s = legacy == null ? "" : legacy;
        switch (s) {
            case OK:
                return NoDataState.OK;
            case "":
            case NO_DATA:
            case KEEP_STATE:
                return NoDataState.NO_DATA;
            case ALERTING:
                return NoDataState.ALERTING;
            default:
                log.warn("Unable to translate NoData state '{}', using default {}", s, NoDataState.NO_DATA.value());
                return NoDataState.NO_DATA;
        }
    }

    /**
     * Translates a legacy execution-error policy.
     *
     * @param legacy the legacy value, may be empty
     * @return the unified error state, {@link ExecErrState#ERROR} for unknown values
     */
    public static ExecErrState translateExecErr(String legacy) {
        String s = legacy == null ? "" : legacy;
        switch (s) {
            case "":
            case ALERTING:
                return ExecErrState.ALERTING;
            case KEEP_STATE:
                return ExecErrState.ERROR;
            case OK:
                return ExecErrState.OK;
            default:
                log.warn("Unable to translate execution error state '{}', using default {}", s, ExecErrState.ERROR.value());
                return ExecErrState.ERROR;
        }
    }
}
