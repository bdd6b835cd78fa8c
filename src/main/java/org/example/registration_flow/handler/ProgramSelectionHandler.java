package org.example.registration_flow.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.flow.FlowState;
import org.example.registration_flow.flow.FlowStateHandle;
import org.example.registration_flow.flow.FlowStatePatch;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.ProgramSelectionView;
import org.example.registration_flow.handler.view.ProgramSelectionView.Stage;
import org.example.registration_flow.model.Program;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RegistrationApiClient;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Первый шаг: выбор программы.
 * <p>
 * Показываем только активные программы с открытой регистрацией.
 * Выбор программы создаёт на сервере черновик регистрации.
 */
@Slf4j
public class ProgramSelectionHandler extends AbstractStepHandler {

    static final String RESOURCE_PROGRAMS = "programs";
    static final String RESOURCE_START = "start";

    private final RegistrationApiClient api;
    private final Clock clock;

    private volatile Stage stage = Stage.LOADING;
    private volatile List<Program> openPrograms = List.of();
    private volatile String searchTerm;
    private volatile String season;
    private volatile String error;

    public ProgramSelectionHandler(FlowStateHandle flow, Executor executor,
                                   RegistrationApiClient api, Clock clock) {
        super(flow, executor);
        this.api = api;
        this.clock = clock;
    }

    @Override
    public FlowStep step() {
        return FlowStep.PROGRAM_SELECT;
    }

    @Override
    public CompletableFuture<Void> onEnter(boolean movingForward) {
        stage = Stage.LOADING;
        error = null;
        return request(RESOURCE_PROGRAMS, api::listPrograms, this::applyPrograms);
    }

    private void applyPrograms(ApiResult<List<Program>> result) {
        if (!result.isSuccess()) {
            log.warn("Список программ не загрузился: {}", result.error());
            stage = Stage.ERROR;
            error = result.error();
            return;
        }
        LocalDate today = LocalDate.now(clock);
        List<Program> all = result.value() == null ? List.of() : result.value();
        openPrograms = all.stream()
                .filter(Objects::nonNull)
                .filter(program -> program.isRegistrationOpen(today))
                .collect(Collectors.toList());
        stage = Stage.READY;
        log.info("Программ с открытой регистрацией: {} из {}", openPrograms.size(), all.size());
    }

    public void search(String term) {
        this.searchTerm = term;
    }

    /**
     * Фильтр по сезону. null или пустая строка = все сезоны.
     */
    public void filterBySeason(String season) {
        this.season = season;
    }

    /**
     * Программы с учётом поиска (название / описание, без учёта регистра) и сезона.
     */
    public List<Program> visiblePrograms() {
        String term = normalize(searchTerm);
        String seasonFilter = normalize(season);
        return openPrograms.stream()
                .filter(program -> term == null
                        || contains(program.getName(), term)
                        || contains(program.getDescription(), term))
                .filter(program -> seasonFilter == null
                        || seasonFilter.equals(normalize(program.getSeason())))
                .collect(Collectors.toList());
    }

    /**
     * Сезоны, которые есть среди открытых программ, для выпадающего списка.
     */
    public List<String> seasons() {
        return openPrograms.stream()
                .map(Program::getSeason)
                .filter(value -> value != null && !value.isBlank())
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Выбрать программу: POST /registration-flow/start и переход дальше.
     * <p>
     * Если вернулись назад и выбрали ту же программу, черновик уже есть - сеть не нужна.
     */
    public CompletableFuture<Void> select(String programId) {
        Program program = openPrograms.stream()
                .filter(candidate -> Objects.equals(candidate.getId(), programId))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown program: " + programId));

        FlowState state = flow.state();
        Program previous = state.getSelectedProgram();
        if (state.getRegistrationId() != null && previous != null && Objects.equals(previous.getId(), programId)) {
            log.info("Программа {} уже выбрана, черновик {} переиспользуем", programId, state.getRegistrationId());
            flow.advanceFrom(FlowStep.PROGRAM_SELECT, FlowStatePatch.builder().selectedProgram(program).build());
            return CompletableFuture.completedFuture(null);
        }

        stage = Stage.STARTING;
        error = null;
        return request(RESOURCE_START, () -> api.startRegistration(programId), result -> {
            if (!result.isSuccess()) {
                log.warn("Не удалось начать регистрацию на программу {}: {}", programId, result.error());
                stage = Stage.ERROR;
                error = result.error();
                return;
            }
            log.info("Черновик регистрации {} создан для программы '{}'", result.value(), program.getName());
            stage = Stage.READY;
            flow.advanceFrom(FlowStep.PROGRAM_SELECT, FlowStatePatch.builder()
                    .selectedProgram(program)
                    .registrationId(result.value())
                    .build());
        });
    }

    public ProgramSelectionView view() {
        return new ProgramSelectionView(stage, visiblePrograms(), seasons(), searchTerm, season, error);
    }

    public Stage getStage() {
        return stage;
    }

    private static boolean contains(String text, String term) {
        return text != null && text.toLowerCase(Locale.ROOT).contains(term);
    }

    private static String normalize(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
