package com.appraisehub.backend.service;

import com.appraisehub.backend.dto.GenerationResult;
import com.appraisehub.backend.dto.InitiateAppraisalRequest;
import com.appraisehub.backend.dto.InitiationResult;
import com.appraisehub.backend.dto.ProgressReport;
import com.appraisehub.backend.entity.AppraisalGroup;
import com.appraisehub.backend.entity.Evaluation;
import com.appraisehub.backend.entity.FrequencyCalendar;
import com.appraisehub.backend.entity.FrequencyCalendarDetail;
import com.appraisehub.backend.entity.InitiatedAppraisal;
import com.appraisehub.backend.entity.InitiatedAppraisal.AppraisalType;
import com.appraisehub.backend.entity.InitiatedAppraisal.CampaignStatus;
import com.appraisehub.backend.entity.InitiatedAppraisal.PublishType;
import com.appraisehub.backend.entity.User.UserRole;
import com.appraisehub.backend.exception.ConflictException;
import com.appraisehub.backend.exception.ForbiddenException;
import com.appraisehub.backend.exception.ValidationException;
import com.appraisehub.backend.repository.AppraisalGroupMemberRepository;
import com.appraisehub.backend.repository.AppraisalGroupRepository;
import com.appraisehub.backend.repository.EvaluationRepository;
import com.appraisehub.backend.repository.FrequencyCalendarDetailRepository;
import com.appraisehub.backend.repository.FrequencyCalendarRepository;
import com.appraisehub.backend.repository.InitiatedAppraisalRepository;
import com.appraisehub.backend.repository.UserRepository;
import com.appraisehub.backend.security.AppraisalActor;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AppraisalCampaignServiceTest {

    private final AppraisalActor owner = new AppraisalActor(900L, UserRole.HR_MANAGER);
    private final AppraisalActor otherHr = new AppraisalActor(901L, UserRole.HR_MANAGER);

    private InitiatedAppraisalRepository campaignRepository;
    private FrequencyCalendarRepository calendarRepository;
    private FrequencyCalendarDetailRepository calendarDetailRepository;
    private EvaluationRepository evaluationRepository;
    private EvaluationGenerator evaluationGenerator;
    private ScheduledTaskPlanner taskPlanner;
    private ProgressAggregator progressAggregator;
    private NotificationDispatcher notificationDispatcher;
    private AppraisalCampaignService service;
    private AppraisalGroup group;

    @BeforeEach
    void setUp() {
        campaignRepository = mock(InitiatedAppraisalRepository.class);
        calendarRepository = mock(FrequencyCalendarRepository.class);
        calendarDetailRepository = mock(FrequencyCalendarDetailRepository.class);
        evaluationRepository = mock(EvaluationRepository.class);
        evaluationGenerator = mock(EvaluationGenerator.class);
        taskPlanner = mock(ScheduledTaskPlanner.class);
        progressAggregator = mock(ProgressAggregator.class);
        notificationDispatcher = mock(NotificationDispatcher.class);
        CacheService cacheService = mock(CacheService.class);
        AppraisalGroupRepository groupRepository = mock(AppraisalGroupRepository.class);

        AppraisalGroupService groupService = new AppraisalGroupService(groupRepository,
                mock(AppraisalGroupMemberRepository.class), mock(UserRepository.class), campaignRepository,
                cacheService, Clock.systemUTC());
        service = new AppraisalCampaignService(campaignRepository, calendarRepository, calendarDetailRepository,
                evaluationRepository, groupService, evaluationGenerator, taskPlanner, progressAggregator,
                notificationDispatcher, cacheService);

        group = new AppraisalGroup();
        group.setId(7L);
        group.setName("Engineering");
        group.setCreatedById(900L);
        when(groupRepository.findById(7L)).thenReturn(Optional.of(group));

        when(campaignRepository.save(any(InitiatedAppraisal.class))).thenAnswer(inv -> {
            InitiatedAppraisal campaign = inv.getArgument(0);
            if (campaign.getId() == null) {
                campaign.setId(42L);
            }
            return campaign;
        });
        when(taskPlanner.planScheduledTasks(anyLong())).thenReturn(List.of());
    }

    private static InitiateAppraisalRequest questionnaireRequest() {
        InitiateAppraisalRequest request = new InitiateAppraisalRequest();
        request.setAppraisalGroupId(7L);
        request.setAppraisalType(AppraisalType.QUESTIONNAIRE_BASED);
        request.setQuestionnaireTemplateIds(List.of(100L));
        return request;
    }

    private InitiatedAppraisal existingCampaign(CampaignStatus status) {
        InitiatedAppraisal campaign = new InitiatedAppraisal();
        campaign.setId(42L);
        campaign.setAppraisalGroup(group);
        campaign.setAppraisalType(AppraisalType.OKR_BASED);
        campaign.setCreatedById(900L);
        campaign.setStatus(status);
        when(campaignRepository.findById(42L)).thenReturn(Optional.of(campaign));
        return campaign;
    }

    @Nested
    @DisplayName("Initiate")
    class Initiate {

        @Test
        @DisplayName("publish now generates immediately and applies defaults")
        void publishNow() {
            GenerationResult generation = new GenerationResult();
            generation.setCreated(3);
            when(evaluationGenerator.generateEvaluations(42L)).thenReturn(generation);

            InitiationResult result = service.initiate(questionnaireRequest(), owner);

            assertThat(result.getCampaign().getId()).isEqualTo(42L);
            assertThat(result.getCampaign().getStatus()).isEqualTo(CampaignStatus.ACTIVE);
            assertThat(result.getCampaign().getDaysToClose()).isEqualTo(30);
            assertThat(result.getCampaign().getNumberOfReminders()).isEqualTo(3);
            assertThat(result.getCampaign().getCreatedById()).isEqualTo(900L);
            assertThat(result.getGeneration().getCreated()).isEqualTo(3);
            verify(taskPlanner).planScheduledTasks(42L);
        }

        @Test
        @DisplayName("the campaign is stored before any evaluation is written")
        void campaignStoredFirst() {
            when(evaluationGenerator.generateEvaluations(42L)).thenReturn(new GenerationResult());

            service.initiate(questionnaireRequest(), owner);

            InOrder order = inOrder(campaignRepository, evaluationGenerator, taskPlanner);
            order.verify(campaignRepository).save(any(InitiatedAppraisal.class));
            order.verify(evaluationGenerator).generateEvaluations(42L);
            order.verify(taskPlanner).planScheduledTasks(42L);
        }

        @Test
        @DisplayName("a planning failure leaves the stored campaign and its evaluations in place")
        void planningFailureKeepsCampaign() {
            GenerationResult generation = new GenerationResult();
            generation.setCreated(2);
            when(evaluationGenerator.generateEvaluations(42L)).thenReturn(generation);
            when(taskPlanner.planScheduledTasks(42L)).thenThrow(new ConflictException("slot already planned"));

            assertThatThrownBy(() -> service.initiate(questionnaireRequest(), owner))
                    .isInstanceOf(ConflictException.class);

            verify(campaignRepository).save(any(InitiatedAppraisal.class));
            verify(campaignRepository, never()).delete(any());
            verify(evaluationGenerator).generateEvaluations(42L);
        }

        @Test
        @DisplayName("an inactive group cannot start a campaign")
        void inactiveGroup() {
            group.setStatus(AppraisalGroup.GroupStatus.INACTIVE);

            assertThatThrownBy(() -> service.initiate(questionnaireRequest(), owner))
                    .isInstanceOf(ValidationException.class)
                    .hasMessage("Appraisal group 7 is inactive");
            verify(campaignRepository, never()).save(any());
        }

        @Test
        @DisplayName("questionnaire campaigns need a template")
        void questionnaireNeedsTemplate() {
            InitiateAppraisalRequest request = questionnaireRequest();
            request.setQuestionnaireTemplateIds(List.of());

            assertThatThrownBy(() -> service.initiate(request, owner))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("questionnaire template");
            verify(campaignRepository, never()).save(any());
        }

        @Test
        @DisplayName("KPI campaigns need a document")
        void kpiNeedsDocument() {
            InitiateAppraisalRequest request = questionnaireRequest();
            request.setAppraisalType(AppraisalType.KPI_BASED);

            assertThatThrownBy(() -> service.initiate(request, owner))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Document");
        }

        @Test
        @DisplayName("calendar publishing without a calendar is rejected")
        void calendarRequired() {
            InitiateAppraisalRequest request = questionnaireRequest();
            request.setPublishType(PublishType.AS_PER_CALENDAR);

            assertThatThrownBy(() -> service.initiate(request, owner))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("calendar publishing defers generation")
        void calendarDefersGeneration() {
            FrequencyCalendar calendar = new FrequencyCalendar();
            calendar.setId(3L);
            when(calendarRepository.findById(3L)).thenReturn(Optional.of(calendar));
            InitiateAppraisalRequest request = questionnaireRequest();
            request.setPublishType(PublishType.AS_PER_CALENDAR);
            request.setFrequencyCalendarId(3L);

            InitiationResult result = service.initiate(request, owner);

            assertThat(result.getGeneration()).isNull();
            assertThat(result.getCampaign().getStatus()).isEqualTo(CampaignStatus.DRAFT);
            verify(evaluationGenerator, never()).generateEvaluations(anyLong());
            verify(taskPlanner).planScheduledTasks(42L);
        }

        @Test
        @DisplayName("period timings must belong to the chosen calendar")
        void foreignPeriodRejected() {
            FrequencyCalendar calendar = new FrequencyCalendar();
            calendar.setId(3L);
            FrequencyCalendar otherCalendar = new FrequencyCalendar();
            otherCalendar.setId(4L);
            FrequencyCalendarDetail foreign = new FrequencyCalendarDetail();
            foreign.setId(50L);
            foreign.setFrequencyCalendar(otherCalendar);
            when(calendarRepository.findById(3L)).thenReturn(Optional.of(calendar));
            when(calendarDetailRepository.findById(50L)).thenReturn(Optional.of(foreign));

            InitiateAppraisalRequest request = questionnaireRequest();
            request.setFrequencyCalendarId(3L);
            request.setDetailTimings(List.of(new InitiateAppraisalRequest.CalendarDetailTiming(50L, 0, 10, 1)));

            assertThatThrownBy(() -> service.initiate(request, owner))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("does not belong");
        }

        @Test
        @DisplayName("too many reminders are rejected")
        void reminderCap() {
            InitiateAppraisalRequest request = questionnaireRequest();
            request.setNumberOfReminders(11);

            assertThatThrownBy(() -> service.initiate(request, owner))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("HR cannot initiate against another HR manager's group")
        void foreignGroup() {
            assertThatThrownBy(() -> service.initiate(questionnaireRequest(), otherHr))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("closing twice is a conflict")
        void closeTwice() {
            existingCampaign(CampaignStatus.CLOSED);

            assertThatThrownBy(() -> service.close(42L, owner)).isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("the group cannot change once evaluations exist")
        void changeGroupAfterGeneration() {
            existingCampaign(CampaignStatus.ACTIVE);
            when(evaluationRepository.existsByInitiatedAppraisalId(42L)).thenReturn(true);

            assertThatThrownBy(() -> service.changeGroup(42L, 7L, owner))
                    .isInstanceOf(ConflictException.class);
        }

        @Test
        @DisplayName("a campaign cannot move to an inactive group")
        void changeGroupToInactive() {
            existingCampaign(CampaignStatus.DRAFT);
            group.setStatus(AppraisalGroup.GroupStatus.INACTIVE);

            assertThatThrownBy(() -> service.changeGroup(42L, 7L, owner))
                    .isInstanceOf(ValidationException.class);
        }

        @Test
        @DisplayName("another HR manager cannot read the campaign")
        void foreignCampaign() {
            existingCampaign(CampaignStatus.ACTIVE);

            assertThatThrownBy(() -> service.getCampaign(42L, otherHr))
                    .isInstanceOf(ForbiddenException.class);
        }
    }

    @Nested
    @DisplayName("Reminders")
    class Reminders {

        private ProgressReport progress(long employeeId, boolean completed) {
            ProgressReport.EmployeeProgress entry = new ProgressReport.EmployeeProgress();
            entry.setEmployeeId(employeeId);
            entry.setIsCompleted(completed);
            ProgressReport report = new ProgressReport();
            report.getEmployeeProgress().add(entry);
            return report;
        }

        @Test
        @DisplayName("pending employees are reminded")
        void reminded() {
            existingCampaign(CampaignStatus.ACTIVE);
            Evaluation evaluation = new Evaluation();
            when(progressAggregator.computeProgress(42L)).thenReturn(progress(5L, false));
            when(evaluationRepository.findByEmployeeIdAndInitiatedAppraisalId(5L, 42L))
                    .thenReturn(Optional.of(evaluation));

            service.sendReminder(42L, 5L, owner);

            verify(notificationDispatcher).reminder(42L, evaluation, 5L);
        }

        @Test
        @DisplayName("employees outside the campaign are refused")
        void notParticipant() {
            existingCampaign(CampaignStatus.ACTIVE);
            when(progressAggregator.computeProgress(42L)).thenReturn(progress(5L, false));

            assertThatThrownBy(() -> service.sendReminder(42L, 6L, owner))
                    .isInstanceOf(ForbiddenException.class);
        }

        @Test
        @DisplayName("completed employees are not reminded")
        void alreadyCompleted() {
            existingCampaign(CampaignStatus.ACTIVE);
            when(progressAggregator.computeProgress(42L)).thenReturn(progress(5L, true));

            assertThatThrownBy(() -> service.sendReminder(42L, 5L, owner))
                    .isInstanceOf(ValidationException.class);
            verify(notificationDispatcher, never()).reminder(anyLong(), any(), anyLong());
        }

        @Test
        @DisplayName("only active campaigns send reminders")
        void inactiveCampaign() {
            existingCampaign(CampaignStatus.DRAFT);

            assertThatThrownBy(() -> service.sendReminder(42L, 5L, owner))
                    .isInstanceOf(ValidationException.class);
        }
    }
}
