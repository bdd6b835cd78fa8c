package org.example.registration_flow.handler;

import lombok.extern.slf4j.Slf4j;
import org.example.registration_flow.flow.FlowStateHandle;
import org.example.registration_flow.flow.FlowStatePatch;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.CustomFormView;
import org.example.registration_flow.handler.view.CustomFormView.Stage;
import org.example.registration_flow.handler.view.FormFieldView;
import org.example.registration_flow.model.FieldDescriptor;
import org.example.registration_flow.model.FieldValue;
import org.example.registration_flow.model.FieldValueMap;
import org.example.registration_flow.model.Program;
import org.example.registration_flow.model.RegistrationFormSchema;
import org.example.registration_flow.model.ValidationErrors;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RegistrationApiClient;
import org.example.registration_flow.service.ValidationEngine;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Шаг кастомной формы программы.
 * <p>
 * Как работает:
 * 1. При входе грузим схему формы выбранной программы (404 = формы нет)
 * 2. Значения = умолчания схемы + то, что уже лежит в FlowState
 * 3. Каждое изменение поля сразу проверяется и сохраняется в FlowState (patch)
 * 4. submit() проверяет всю форму, отправляет ответы и переводит на следующий шаг
 * <p>
 * Схема после загрузки не меняется, поэтому при возврате на шаг повторно её не грузим.
 */
@Slf4j
public class CustomFormHandler extends AbstractStepHandler {

    static final String RESOURCE_SCHEMA = "schema";
    static final String RESOURCE_SUBMIT = "submit-form";
    static final String NO_PROGRAM_SELECTED = "No program selected";

    private final RegistrationApiClient api;
    private final ValidationEngine validation;
    private final boolean autoSkipEmptyForm;

    private volatile Stage stage = Stage.LOADING;

    /** null при stage = NO_FORM_REQUIRED */
    private volatile RegistrationFormSchema schema;
    private volatile String loadedProgramId;

    // Значения и ошибки заменяются целиком (copy-on-write): ответы сети приходят из пула
    private volatile FieldValueMap values = FieldValueMap.empty();
    private volatile ValidationErrors errors = ValidationErrors.none();
    private volatile String loadError;

    public CustomFormHandler(FlowStateHandle flow, Executor executor,
                             RegistrationApiClient api, ValidationEngine validation,
                             boolean autoSkipEmptyForm) {
        super(flow, executor);
        this.api = api;
        this.validation = validation;
        this.autoSkipEmptyForm = autoSkipEmptyForm;
    }

    @Override
    public FlowStep step() {
        return FlowStep.CUSTOM_FORM;
    }

    @Override
    public CompletableFuture<Void> onEnter(boolean movingForward) {
        Program program = flow.state().getSelectedProgram();
        loadError = null;
        errors = ValidationErrors.none();

        if (program == null) {
            log.warn("Шаг формы открыт без выбранной программы");
            stage = Stage.ERROR;
            loadError = NO_PROGRAM_SELECTED;
            return CompletableFuture.completedFuture(null);
        }

        String programId = program.getId();
        if (programId != null && programId.equals(loadedProgramId)) {
            log.debug("Схема формы программы {} уже загружена", programId);
            if (schema == null) {
                stage = Stage.NO_FORM_REQUIRED;
            } else {
                showForm(schema);
            }
            return CompletableFuture.completedFuture(null);
        }

        stage = Stage.LOADING;
        return request(RESOURCE_SCHEMA,
                () -> api.fetchRegistrationForm(programId),
                result -> applySchema(programId, result, movingForward));
    }

    @Override
    public CompletableFuture<Void> reload() {
        loadedProgramId = null;
        schema = null;
        return onEnter(true);
    }

    private void applySchema(String programId, ApiResult<RegistrationFormSchema> result, boolean movingForward) {
        if (result.isNotFound() || (result.isSuccess() && isBlank(result.value()))) {
            log.info("У программы {} нет кастомной формы", programId);
            schema = null;
            loadedProgramId = programId;
            stage = Stage.NO_FORM_REQUIRED;
            if (movingForward && autoSkipEmptyForm && !flow.state().isCompleted(FlowStep.CUSTOM_FORM)) {
                flow.advanceFrom(FlowStep.CUSTOM_FORM, FlowStatePatch.builder().formCompleted(true).build());
            }
            return;
        }

        if (!result.isSuccess()) {
            log.warn("Не удалось загрузить форму программы {}: {}", programId, result.error());
            stage = Stage.ERROR;
            loadError = result.error();
            return;
        }

        RegistrationFormSchema loaded = result.value();
        Optional<String> schemaError = loaded.findSchemaError();
        if (schemaError.isPresent()) {
            log.warn("Схема формы программы {} некорректна: {}", programId, schemaError.get());
            stage = Stage.ERROR;
            loadError = schemaError.get();
            return;
        }

        validation.prepare(loaded);
        schema = loaded;
        loadedProgramId = programId;
        log.info("Форма '{}' загружена: {} полей", loaded.getName(), loaded.orderedFields().size());
        showForm(loaded);
    }

    private void showForm(RegistrationFormSchema current) {
        values = FieldValueMap.initialize(current, flow.state().getFormData());
        stage = Stage.READY;
    }

    /**
     * Пользователь изменил поле.
     *
     * @return ошибка этого поля после изменения (если есть)
     */
    public Optional<String> updateField(String fieldName, FieldValue value) {
        FieldDescriptor descriptor = requireField(fieldName);

        FieldValueMap updated = values.copy();
        updated.put(fieldName, value);
        values = updated;

        ValidationErrors updatedErrors = errors.copy();
        updatedErrors.set(fieldName, validation.validateField(descriptor, value));
        errors = updatedErrors;

        FieldValueMap delta = new FieldValueMap();
        delta.put(fieldName, value);
        flow.patch(FlowStatePatch.builder().formData(delta).build());

        return updatedErrors.get(fieldName);
    }

    /**
     * То же, но из "сырого" ввода: строка приводится к типу поля (checkbox → флаг).
     */
    public Optional<String> updateField(String fieldName, String raw) {
        FieldDescriptor descriptor = requireField(fieldName);
        return updateField(fieldName, FieldValue.fromInput(descriptor.getFieldType(), raw));
    }

    /**
     * Кнопка "Продолжить".
     */
    public CompletableFuture<Void> submit() {
        Stage current = stage;
        if (current == Stage.NO_FORM_REQUIRED) {
            flow.advanceFrom(FlowStep.CUSTOM_FORM, FlowStatePatch.builder().formCompleted(true).build());
            return CompletableFuture.completedFuture(null);
        }
        if (current == Stage.SUBMITTING) {
            log.debug("Форма уже отправляется - повторное нажатие пропущено");
            return CompletableFuture.completedFuture(null);
        }
        if (current == Stage.LOADING) {
            log.debug("Форма ещё грузится - нажатие пропущено");
            return CompletableFuture.completedFuture(null);
        }
        if (current == Stage.ERROR) {
            // loadError остаётся на экране, выход - reload()
            log.info("Форма не загружена ({}) - отправлять нечего", loadError);
            return CompletableFuture.completedFuture(null);
        }

        RegistrationFormSchema active = schema;
        FieldValueMap snapshot = snapshot(active);
        ValidationErrors found = validation.validateAll(active, snapshot);
        errors = found;
        if (!found.isEmpty()) {
            log.info("Форма не прошла проверку: {} ошибок", found.size());
            return CompletableFuture.completedFuture(null);
        }

        String registrationId = flow.state().getRegistrationId();
        if (registrationId == null) {
            errors = generalError(found, NO_REGISTRATION_ID);
            return CompletableFuture.completedFuture(null);
        }

        stage = Stage.SUBMITTING;
        return request(RESOURCE_SUBMIT,
                () -> api.submitForm(registrationId, snapshot),
                result -> {
                    stage = Stage.READY;
                    if (result.isSuccess()) {
                        log.info("Ответы формы отправлены: registrationId={}", registrationId);
                        flow.advanceFrom(FlowStep.CUSTOM_FORM, FlowStatePatch.builder()
                                .formData(snapshot)
                                .formCompleted(true)
                                .build());
                    } else {
                        errors = generalError(errors, result.error());
                    }
                });
    }

    public CustomFormView render() {
        RegistrationFormSchema current = schema;
        Stage currentStage = stage;
        List<FormFieldView> fields = new ArrayList<>();
        if (current != null && (currentStage == Stage.READY || currentStage == Stage.SUBMITTING)) {
            FieldValueMap currentValues = values;
            ValidationErrors currentErrors = errors;
            for (FieldDescriptor descriptor : current.orderedFields()) {
                String name = descriptor.getFieldName();
                fields.add(new FormFieldView(
                        name,
                        descriptor.getFieldType(),
                        descriptor.displayLabel(),
                        descriptor.getPlaceholder(),
                        descriptor.getHelpText(),
                        descriptor.isRequired(),
                        descriptor.getOptions(),
                        currentValues.get(name).orElseGet(() -> FieldValue.initialFor(descriptor)),
                        currentErrors.get(name).orElse(null)));
            }
        }
        return new CustomFormView(
                currentStage,
                current == null ? null : current.getName(),
                current == null ? null : current.getDescription(),
                List.copyOf(fields),
                errors.general().orElse(null),
                loadError);
    }

    public Stage getStage() {
        return stage;
    }

    public ValidationErrors getErrors() {
        return errors.copy();
    }

    public FieldValueMap getValues() {
        return values.copy();
    }

    /**
     * Значения только тех полей, что есть в схеме: ответы другой программы не отправляем.
     */
    private FieldValueMap snapshot(RegistrationFormSchema active) {
        FieldValueMap current = values;
        FieldValueMap snapshot = new FieldValueMap();
        for (FieldDescriptor descriptor : active.orderedFields()) {
            String name = descriptor.getFieldName();
            snapshot.put(name, current.get(name).orElseGet(() -> FieldValue.initialFor(descriptor)));
        }
        return snapshot;
    }

    private FieldDescriptor requireField(String fieldName) {
        RegistrationFormSchema current = schema;
        if (current == null) {
            throw new IllegalStateException("Registration form is not loaded");
        }
        return current.findField(fieldName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown field: " + fieldName));
    }

    private static ValidationErrors generalError(ValidationErrors base, String message) {
        ValidationErrors updated = base.copy();
        updated.put(ValidationErrors.GENERAL, message);
        return updated;
    }

    private static boolean isBlank(RegistrationFormSchema loaded) {
        return loaded == null || loaded.orderedFields().isEmpty();
    }
}
