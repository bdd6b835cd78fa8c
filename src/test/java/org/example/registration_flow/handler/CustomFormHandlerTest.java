package org.example.registration_flow.handler;

import org.example.registration_flow.Fixtures;
import org.example.registration_flow.flow.FlowStatePatch;
import org.example.registration_flow.flow.FlowStep;
import org.example.registration_flow.handler.view.CustomFormView;
import org.example.registration_flow.handler.view.FormFieldView;
import org.example.registration_flow.model.FieldType;
import org.example.registration_flow.model.FieldValue;
import org.example.registration_flow.model.FieldValueMap;
import org.example.registration_flow.model.RegistrationFormSchema;
import org.example.registration_flow.model.ValidationErrors;
import org.example.registration_flow.service.ApiResult;
import org.example.registration_flow.service.RegistrationApiClient;
import org.example.registration_flow.service.ValidationEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.example.registration_flow.Fixtures.PROGRAM_ID;
import static org.example.registration_flow.Fixtures.REGISTRATION_ID;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("CustomFormHandler")
class CustomFormHandlerTest {

    @Mock
    private RegistrationApiClient api;

    private StoreBackedFlow flow;
    private CustomFormHandler handler;

    @BeforeEach
    void setUp() {
        flow = new StoreBackedFlow().at(FlowStep.CUSTOM_FORM, FlowStatePatch.builder()
                .selectedProgram(Fixtures.program(PROGRAM_ID, "U10 Fall"))
                .registrationId(REGISTRATION_ID)
                .build());
        handler = new CustomFormHandler(flow, Runnable::run, api, new ValidationEngine(Fixtures.CLOCK), true);
    }

    private void loadPlayerForm() {
        when(api.fetchRegistrationForm(PROGRAM_ID)).thenReturn(ApiResult.success(Fixtures.playerForm()));
        handler.onEnter(true).join();
    }

    private void fillValidForm() {
        handler.updateField("first_name", "Ana");
        handler.updateField("last_name", "Rivera");
        handler.updateField("email", "ana@club.org");
        handler.updateField("waiver", "on");
    }

    @Nested
    @DisplayName("Загрузка схемы")
    class LoadingTests {

        @Test
        @DisplayName("404 - формы нет, шаг сам отмечается завершённым без отправки")
        void noFormAutoCompletes() {
            when(api.fetchRegistrationForm(PROGRAM_ID)).thenReturn(ApiResult.failure("Not found", 404));

            handler.onEnter(true).join();

            assertThat(handler.getStage()).isEqualTo(CustomFormView.Stage.NO_FORM_REQUIRED);
            assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.FEE_SUMMARY);
            assertThat(flow.state().isFormCompleted()).isTrue();
            assertThat(flow.advances).singleElement()
                    .satisfies(patch -> assertThat(patch.getFormData()).isNull());
            verify(api, never()).submitForm(anyString(), any());
        }

        @Test
        @DisplayName("404 на уже пройденном шаге - без автоперехода, но можно продолжить")
        void noFormOnCompletedStep() {
            flow.advance(FlowStatePatch.empty());
            flow.retreat();
            flow.advances.clear();
            when(api.fetchRegistrationForm(PROGRAM_ID)).thenReturn(ApiResult.failure("Not found", 404));

            handler.onEnter(false).join();

            assertThat(flow.advances).isEmpty();
            assertThat(handler.render().isCompletable()).isTrue();

            handler.submit().join();

            assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.FEE_SUMMARY);
        }

        @Test
        @DisplayName("Ошибка сети - стадия ERROR с текстом, повтор грузит заново")
        void loadFailureAndRetry() {
            when(api.fetchRegistrationForm(PROGRAM_ID))
                    .thenReturn(ApiResult.failure("HTTP 500: Internal Server Error", 500))
                    .thenReturn(ApiResult.success(Fixtures.playerForm()));

            handler.onEnter(true).join();

            assertThat(handler.render().loadError()).isEqualTo("HTTP 500: Internal Server Error");
            assertThat(handler.getStage()).isEqualTo(CustomFormView.Stage.ERROR);

            handler.reload().join();

            assertThat(handler.getStage()).isEqualTo(CustomFormView.Stage.READY);
        }

        @Test
        @DisplayName("Продолжить во время загрузки и после ошибки загрузки - без исключения и без отправки")
        void submitBeforeFormIsReady() {
            QueuedExecutor queued = new QueuedExecutor();
            handler = new CustomFormHandler(flow, queued, api, new ValidationEngine(Fixtures.CLOCK), true);
            when(api.fetchRegistrationForm(PROGRAM_ID))
                    .thenReturn(ApiResult.failure("HTTP 500: Internal Server Error", 500));

            handler.onEnter(true);
            handler.submit().join();

            assertThat(handler.getStage()).isEqualTo(CustomFormView.Stage.LOADING);

            queued.runAll();
            handler.submit().join();

            assertThat(handler.getStage()).isEqualTo(CustomFormView.Stage.ERROR);
            assertThat(handler.render().loadError()).isEqualTo("HTTP 500: Internal Server Error");
            assertThat(flow.advances).isEmpty();
            assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.CUSTOM_FORM);
            verify(api, never()).submitForm(anyString(), any());
        }

        @Test
        @DisplayName("Некорректная схема - ошибка шага, а не падение")
        void invalidSchema() {
            RegistrationFormSchema broken = RegistrationFormSchema.builder()
                    .name("Broken")
                    .fields(List.of(
                            Fixtures.field("email", FieldType.EMAIL, "Email", true, 1),
                            Fixtures.field("email", FieldType.EMAIL, "Email", true, 2)))
                    .build();
            when(api.fetchRegistrationForm(PROGRAM_ID)).thenReturn(ApiResult.success(broken));

            handler.onEnter(true).join();

            assertThat(handler.getStage()).isEqualTo(CustomFormView.Stage.ERROR);
            assertThat(handler.render().loadError()).isEqualTo("Registration form contains duplicate field 'email'");
        }

        @Test
        @DisplayName("Поля рисуются по sort_order с начальными значениями")
        void rendersFieldsInOrder() {
            loadPlayerForm();

            CustomFormView view = handler.render();

            assertThat(view.formName()).isEqualTo("Player Information");
            assertThat(view.fields()).extracting(FormFieldView::fieldName)
                    .containsExactly("first_name", "last_name", "email", "shirt_size", "waiver");
            assertThat(view.fields().get(4).value()).isEqualTo(FieldValue.flag(false));
            assertThat(view.fields().get(3).options()).hasSize(2);
            assertThat(view.fields()).noneMatch(FormFieldView::hasError);
        }

        @Test
        @DisplayName("Ответ на устаревший запрос схемы выбрасывается")
        void staleSchemaIsDiscarded() {
            RegistrationFormSchema other = RegistrationFormSchema.builder()
                    .name("Goalkeeper Camp")
                    .fields(List.of(Fixtures.field("glove_size", FieldType.TEXT, "Glove Size", false, 1)))
                    .build();
            when(api.fetchRegistrationForm("prog-2")).thenReturn(ApiResult.success(other));
            // Пока идёт первый запрос, пользователь успел выбрать другую программу
            when(api.fetchRegistrationForm(PROGRAM_ID)).thenAnswer(invocation -> {
                flow.patch(FlowStatePatch.builder().selectedProgram(Fixtures.program("prog-2", "GK Camp")).build());
                handler.onEnter(true).join();
                return ApiResult.success(Fixtures.playerForm());
            });

            handler.onEnter(true).join();

            assertThat(handler.render().formName()).isEqualTo("Goalkeeper Camp");
            assertThat(handler.render().fields()).extracting(FormFieldView::fieldName).containsExactly("glove_size");
        }
    }

    @Nested
    @DisplayName("Ввод")
    class InputTests {

        @Test
        @DisplayName("Проверяется только изменённое поле")
        void validatesOnlyChangedField() {
            loadPlayerForm();

            assertThat(handler.updateField("email", "not-an-email")).contains("Email must be a valid email address");

            ValidationErrors errors = handler.getErrors();
            assertThat(errors.asMap()).containsOnlyKeys("email");
        }

        @Test
        @DisplayName("Исправленное поле теряет ошибку")
        void fixingFieldClearsError() {
            loadPlayerForm();
            handler.updateField("email", "nope");

            assertThat(handler.updateField("email", "ana@club.org")).isEmpty();
            assertThat(handler.getErrors().isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Каждое изменение сохраняется в FlowState")
        void patchesFlowState() {
            loadPlayerForm();

            handler.updateField("first_name", "Ana");
            handler.updateField("waiver", "true");

            FieldValueMap formData = flow.state().getFormData();
            assertThat(formData.text("first_name")).isEqualTo("Ana");
            assertThat(formData.get("waiver")).contains(FieldValue.flag(true));
            assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.CUSTOM_FORM);
        }

        @Test
        @DisplayName("Неизвестное поле - IllegalArgumentException")
        void unknownField() {
            loadPlayerForm();

            assertThatThrownBy(() -> handler.updateField("favourite_color", "blue"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("favourite_color");
        }

        @Test
        @DisplayName("Сохранённые ответы подставляются при возврате на шаг")
        void restoresAnswersFromFlowState() {
            FieldValueMap saved = new FieldValueMap();
            saved.put("first_name", FieldValue.text("Ana"));
            flow.patch(FlowStatePatch.builder().formData(saved).build());

            loadPlayerForm();

            assertThat(handler.getValues().text("first_name")).isEqualTo("Ana");
        }
    }

    @Nested
    @DisplayName("Отправка")
    class SubmitTests {

        @Test
        @DisplayName("С ошибками - без сети и без перехода")
        void blockedByValidation() {
            loadPlayerForm();
            handler.updateField("first_name", "Ana");

            handler.submit().join();

            assertThat(handler.getErrors().asMap()).containsOnlyKeys("last_name", "email", "waiver");
            assertThat(handler.render().isCompletable()).isFalse();
            assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.CUSTOM_FORM);
            verify(api, never()).submitForm(anyString(), any());
        }

        @Test
        @DisplayName("Чистая форма отправляется, шаг завершается с formData")
        void submitsAndAdvances() {
            loadPlayerForm();
            fillValidForm();
            when(api.submitForm(eq(REGISTRATION_ID), any())).thenReturn(ApiResult.success(null));

            handler.submit().join();

            ArgumentCaptor<FieldValueMap> sent = ArgumentCaptor.forClass(FieldValueMap.class);
            verify(api).submitForm(eq(REGISTRATION_ID), sent.capture());
            assertThat(sent.getValue().toPayload())
                    .containsEntry("first_name", "Ana")
                    .containsEntry("waiver", true)
                    .containsEntry("shirt_size", "");
            assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.FEE_SUMMARY);
            assertThat(flow.state().isFormCompleted()).isTrue();
            assertThat(flow.advances).singleElement()
                    .satisfies(patch -> assertThat(patch.getFormData().text("email")).isEqualTo("ana@club.org"));
        }

        @Test
        @DisplayName("Ответы чужой программы не отправляются")
        void sendsOnlySchemaFields() {
            FieldValueMap leftover = new FieldValueMap();
            leftover.put("glove_size", FieldValue.text("8"));
            flow.patch(FlowStatePatch.builder().formData(leftover).build());
            loadPlayerForm();
            fillValidForm();
            when(api.submitForm(eq(REGISTRATION_ID), any())).thenReturn(ApiResult.success(null));

            handler.submit().join();

            ArgumentCaptor<FieldValueMap> sent = ArgumentCaptor.forClass(FieldValueMap.class);
            verify(api).submitForm(eq(REGISTRATION_ID), sent.capture());
            assertThat(sent.getValue().containsKey("glove_size")).isFalse();
        }

        @Test
        @DisplayName("Ошибка сервера - в _general, остаёмся на шаге")
        void serverFailureGoesToGeneral() {
            loadPlayerForm();
            fillValidForm();
            when(api.submitForm(eq(REGISTRATION_ID), any()))
                    .thenReturn(ApiResult.failure("Registration is closed", 409));

            handler.submit().join();

            assertThat(handler.getErrors().general()).contains("Registration is closed");
            assertThat(handler.render().generalError()).isEqualTo("Registration is closed");
            assertThat(handler.getStage()).isEqualTo(CustomFormView.Stage.READY);
            assertThat(flow.state().getCurrentStep()).isEqualTo(FlowStep.CUSTOM_FORM);
        }

        @Test
        @DisplayName("Без id регистрации - ошибка в _general")
        void noRegistrationId() {
            flow = new StoreBackedFlow().at(FlowStep.CUSTOM_FORM, FlowStatePatch.builder()
                    .selectedProgram(Fixtures.program(PROGRAM_ID, "U10 Fall"))
                    .build());
            handler = new CustomFormHandler(flow, Runnable::run, api, new ValidationEngine(Fixtures.CLOCK), true);
            loadPlayerForm();
            fillValidForm();

            handler.submit().join();

            assertThat(handler.getErrors().general()).contains("No registration ID available");
            verify(api, never()).submitForm(anyString(), any());
        }

        @Test
        @DisplayName("Повторное нажатие во время отправки игнорируется")
        void doubleSubmitIgnored() {
            QueuedExecutor queued = new QueuedExecutor();
            handler = new CustomFormHandler(flow, queued, api, new ValidationEngine(Fixtures.CLOCK), true);
            when(api.fetchRegistrationForm(PROGRAM_ID)).thenReturn(ApiResult.success(Fixtures.playerForm()));
            handler.onEnter(true);
            queued.runAll();
            fillValidForm();
            when(api.submitForm(eq(REGISTRATION_ID), any())).thenReturn(ApiResult.success(null));

            handler.submit();
            handler.submit();
            queued.runAll();

            verify(api, times(1)).submitForm(eq(REGISTRATION_ID), any());
            assertThat(flow.advances).hasSize(1);
        }
    }
}
