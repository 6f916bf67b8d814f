package com.boxline.billing.infrastructure.wiring;

import com.boxline.billing.application.batch.BoundedBatchRunner;
import com.boxline.billing.application.events.BillingEventHandler;
import com.boxline.billing.application.events.BillingEventRouter;
import com.boxline.billing.application.events.BillingEventService;
import com.boxline.billing.application.events.CustomerEventHandler;
import com.boxline.billing.application.events.MembershipEventHandler;
import com.boxline.billing.application.events.PaymentEventHandler;
import com.boxline.billing.application.events.SubscriptionEventHandler;
import com.boxline.billing.application.events.TenantResolver;
import com.boxline.billing.application.events.TrialEventHandler;
import com.boxline.billing.application.grace.GracePeriodManager;
import com.boxline.billing.application.notify.BillingNotifier;
import com.boxline.billing.application.overage.OverageBillingEngine;
import com.boxline.billing.application.planchange.PlanChangeWorkflow;
import com.boxline.billing.application.ports.BillingEventStore;
import com.boxline.billing.application.ports.BillingOrderStore;
import com.boxline.billing.application.ports.GracePeriodStore;
import com.boxline.billing.application.ports.MembershipCounter;
import com.boxline.billing.application.ports.NotificationPort;
import com.boxline.billing.application.ports.OverageBillingStore;
import com.boxline.billing.application.ports.PaymentGatewayPort;
import com.boxline.billing.application.ports.PlanCatalog;
import com.boxline.billing.application.ports.PlanChangeRequestStore;
import com.boxline.billing.application.ports.SubscriptionChangeLog;
import com.boxline.billing.application.ports.SubscriptionStore;
import com.boxline.billing.application.ports.TenantStore;
import com.boxline.billing.application.ports.UnitOfWork;
import com.boxline.billing.application.ports.UsageEventStore;
import com.boxline.billing.application.subscription.SubscriptionStateMachine;
import com.boxline.billing.application.usage.UsageLedger;
import com.boxline.billing.domain.pricing.OverageRates;
import com.boxline.billing.infrastructure.gateway.PolarGatewayClient;
import com.boxline.billing.infrastructure.gateway.UnconfiguredPaymentGateway;
import com.boxline.billing.infrastructure.notify.HttpNotificationClient;
import com.boxline.billing.infrastructure.notify.LoggingNotificationPort;
import com.boxline.billing.infrastructure.tx.SpringUnitOfWork;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Billing core wiring shared by the API and the worker.
 *
 * Application services are plain classes; this is the only place that knows which adapter backs
 * which port. Gateway and notification clients fall back to inert implementations when their
 * credentials are missing so local runs start without secrets.
 */
@Configuration
@EnableConfigurationProperties(BillingProperties.class)
public class BillingCoreConfig {

  private static final Logger log = LoggerFactory.getLogger(BillingCoreConfig.class);

  @Bean
  public Clock billingClock() {
    return Clock.systemUTC();
  }

  @Bean
  public OkHttpClient billingHttpClient(
      @Value("${boxline.http.connect-timeout:10s}") Duration connectTimeout,
      @Value("${boxline.http.read-timeout:30s}") Duration readTimeout,
      @Value("${boxline.http.write-timeout:30s}") Duration writeTimeout
  ) {
    return new OkHttpClient.Builder()
        .connectTimeout(connectTimeout)
        .readTimeout(readTimeout)
        .writeTimeout(writeTimeout)
        .build();
  }

  @Bean
  public PaymentGatewayPort paymentGateway(
      OkHttpClient http,
      ObjectMapper mapper,
      @Value("${boxline.gateway.base-url:https://api.polar.sh}") String baseUrl,
      @Value("${boxline.gateway.access-token:}") String accessToken
  ) {
    if (accessToken == null || accessToken.isBlank()) {
      log.warn("boxline.gateway.access-token is not set; gateway calls will fail.");
      return new UnconfiguredPaymentGateway();
    }
    return new PolarGatewayClient(http, mapper, baseUrl, accessToken);
  }

  @Bean
  public NotificationPort notificationPort(
      OkHttpClient http,
      ObjectMapper mapper,
      @Value("${boxline.notifications.base-url:}") String baseUrl,
      @Value("${boxline.notifications.token:}") String token
  ) {
    if (baseUrl == null || baseUrl.isBlank()) {
      log.info("boxline.notifications.base-url is not set; notifications are logged only.");
      return new LoggingNotificationPort();
    }
    return new HttpNotificationClient(http, mapper, baseUrl, token);
  }

  @Bean
  public UnitOfWork unitOfWork(PlatformTransactionManager transactionManager) {
    return new SpringUnitOfWork(transactionManager);
  }

  @Bean
  public BillingNotifier billingNotifier(NotificationPort port, TenantStore tenants, UnitOfWork uow,
                                         BillingProperties props) {
    return new BillingNotifier(port, tenants, uow, props.billingUrl());
  }

  @Bean
  public GracePeriodManager gracePeriodManager(GracePeriodStore store, BillingNotifier notifier, UnitOfWork uow,
                                               Clock clock) {
    return new GracePeriodManager(store, notifier, uow, clock);
  }

  @Bean
  public UsageLedger usageLedger(
      TenantStore tenants,
      SubscriptionStore subscriptions,
      PlanCatalog plans,
      MembershipCounter members,
      UsageEventStore usageEvents,
      GracePeriodManager gracePeriods,
      BillingNotifier notifier,
      BillingProperties props,
      Clock clock
  ) {
    OverageRates defaults = new OverageRates(props.defaultAthleteRate(), props.defaultCoachRate());
    return new UsageLedger(tenants, subscriptions, plans, members, usageEvents, gracePeriods, notifier, defaults,
        clock);
  }

  @Bean
  public SubscriptionStateMachine subscriptionStateMachine(
      SubscriptionStore subscriptions,
      TenantStore tenants,
      PlanCatalog plans,
      GracePeriodManager gracePeriods,
      UsageLedger usage,
      SubscriptionChangeLog changeLog,
      PaymentGatewayPort gateway,
      BillingNotifier notifier,
      UnitOfWork uow,
      Clock clock
  ) {
    return new SubscriptionStateMachine(subscriptions, tenants, plans, gracePeriods, usage, changeLog, gateway,
        notifier, uow, clock);
  }

  @Bean
  public PlanChangeWorkflow planChangeWorkflow(
      PlanChangeRequestStore requests,
      SubscriptionStore subscriptions,
      PlanCatalog plans,
      TenantStore tenants,
      SubscriptionChangeLog changeLog,
      UsageLedger usage,
      GracePeriodManager gracePeriods,
      PaymentGatewayPort gateway,
      BillingNotifier notifier,
      UnitOfWork uow,
      Clock clock
  ) {
    return new PlanChangeWorkflow(requests, subscriptions, plans, tenants, changeLog, usage, gracePeriods, gateway,
        notifier, uow, clock);
  }

  @Bean
  public OverageBillingEngine overageBillingEngine(
      UsageLedger usage,
      OverageBillingStore records,
      BillingOrderStore orders,
      SubscriptionStore subscriptions,
      TenantStore tenants,
      GracePeriodManager gracePeriods,
      BillingNotifier notifier,
      UnitOfWork uow,
      BillingProperties props,
      Clock clock
  ) {
    BillingProperties.Overage o = props.overage();
    BoundedBatchRunner runner = new BoundedBatchRunner(o.batchSize(), o.batchDelay(), o.tenantTimeout());
    return new OverageBillingEngine(usage, records, orders, subscriptions, tenants, gracePeriods, notifier, runner,
        uow, props.currency(), clock);
  }

  @Bean
  public TenantResolver tenantResolver(SubscriptionStore subscriptions, TenantStore tenants) {
    return new TenantResolver(subscriptions, tenants);
  }

  @Bean
  public SubscriptionEventHandler subscriptionEventHandler(SubscriptionStateMachine stateMachine, Clock clock) {
    return new SubscriptionEventHandler(stateMachine, clock);
  }

  @Bean
  public CustomerEventHandler customerEventHandler(TenantStore tenants) {
    return new CustomerEventHandler(tenants);
  }

  @Bean
  public PaymentEventHandler paymentEventHandler(SubscriptionStateMachine stateMachine,
                                                 OverageBillingEngine overage) {
    return new PaymentEventHandler(stateMachine, overage);
  }

  @Bean
  public MembershipEventHandler membershipEventHandler(UsageLedger usage) {
    return new MembershipEventHandler(usage);
  }

  @Bean
  public TrialEventHandler trialEventHandler(SubscriptionStateMachine stateMachine) {
    return new TrialEventHandler(stateMachine);
  }

  @Bean
  public BillingEventRouter billingEventRouter(List<BillingEventHandler> handlers, TenantResolver resolver) {
    return new BillingEventRouter(handlers, resolver);
  }

  @Bean
  public BillingEventService billingEventService(BillingEventStore store, BillingEventRouter router,
                                                 ObjectMapper mapper, Clock clock, BillingProperties props) {
    return new BillingEventService(store, router, mapper, clock, props.eventMaxRetries(),
        props.retryBackoffBase(), props.staleClaimAfter());
  }
}
