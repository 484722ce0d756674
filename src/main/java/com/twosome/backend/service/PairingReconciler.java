package com.twosome.backend.service;

import com.twosome.backend.config.PairingProperties;
import com.twosome.backend.model.Couple;
import com.twosome.backend.model.User;
import com.twosome.backend.repository.CoupleRepository;
import com.twosome.backend.repository.UserRepository;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Repairs account/couple pairs that disagree about membership. Every repair is logged at ERROR: a
 * healthy system never has anything to repair.
 */
@Service
@RequiredArgsConstructor
public class PairingReconciler {

    private static final Logger log = LoggerFactory.getLogger(PairingReconciler.class);

    private final CoupleRepository coupleRepository;
    private final UserRepository userRepository;
    private final PairingProperties pairingProperties;

    @Data
    public static class Report {
        private int deletedCouples;
        private int completedPointers;
        private int removedMembers;
        private int clearedPointers;

        public int total() {
            return deletedCouples + completedPointers + removedMembers + clearedPointers;
        }
    }

    /**
     * Scheduled entry point. It is transactional itself because the call to {@link #reconcile()} below
     * does not pass through the proxy.
     */
    @Scheduled(fixedDelayString = "${twosome.pairing.reconciliation.interval-ms:600000}",
            initialDelayString = "${twosome.pairing.reconciliation.interval-ms:600000}")
    @Transactional
    public void scheduledReconcile() {
        if (!pairingProperties.getReconciliation().isEnabled()) {
            return;
        }
        Report report = reconcile();
        if (report.total() > 0) {
            log.error("RECONCILIATION: repaired {} inconsistencies: {}", report.total(), report);
        } else {
            log.debug("Reconciliation pass found nothing to repair");
        }
    }

    @Transactional
    public Report reconcile() {
        Report report = new Report();

        for (Long coupleId : coupleRepository.findIdsWithoutMembers()) {
            deleteMemberlessCouple(coupleId, report);
        }
        for (Long coupleId : coupleRepository.findIdsWithUnlinkedMembers()) {
            repairCouple(coupleId, report);
        }
        for (Long userId : userRepository.findIdsWithDanglingCoupleRef()) {
            clearDanglingPointer(userId, report);
        }
        return report;
    }

    private void deleteMemberlessCouple(Long coupleId, Report report) {
        List<Long> pointing = userRepository.findIdsByCoupleId(coupleId);
        List<User> users = pointing.isEmpty()
                ? List.of()
                : userRepository.findAllByIdForUpdate(new TreeSet<>(pointing));
        Optional<Couple> locked = coupleRepository.findByIdForUpdate(coupleId);
        if (locked.isEmpty() || !locked.get().isEmpty()) {
            return;
        }
        for (User user : users) {
            if (Objects.equals(user.getCoupleId(), coupleId)) {
                user.setCoupleId(null);
                userRepository.save(user);
                report.setClearedPointers(report.getClearedPointers() + 1);
            }
        }
        coupleRepository.delete(locked.get());
        report.setDeletedCouples(report.getDeletedCouples() + 1);
        log.error("RECONCILIATION: deleted couple {} which had no members", coupleId);
    }

    private void repairCouple(Long coupleId, Report report) {
        List<Long> memberIds = coupleRepository.findMemberIds(coupleId);
        if (memberIds.isEmpty()) {
            return;
        }
        Map<Long, User> users = userRepository.findAllByIdForUpdate(new TreeSet<>(memberIds)).stream()
                .collect(Collectors.toMap(User::getId, Function.identity()));
        Optional<Couple> locked = coupleRepository.findByIdForUpdate(coupleId);
        if (locked.isEmpty()) {
            return;
        }
        Couple couple = locked.get();

        for (Long memberId : List.copyOf(couple.getMemberIds())) {
            User user = users.get(memberId);
            if (user == null) {
                // Listed after the member ids were read; the next pass picks it up
                continue;
            }
            if (user.isDeleted() || (user.isInCouple() && !user.getCoupleId().equals(coupleId))) {
                couple.removeMember(memberId);
                report.setRemovedMembers(report.getRemovedMembers() + 1);
                log.error("RECONCILIATION: removed user {} from couple {} (deleted={}, points at {})",
                        memberId, coupleId, user.isDeleted(), user.getCoupleId());
            } else if (!user.isInCouple()) {
                user.setCoupleId(coupleId);
                userRepository.save(user);
                report.setCompletedPointers(report.getCompletedPointers() + 1);
                log.error("RECONCILIATION: pointed user {} back at couple {}", memberId, coupleId);
            }
        }

        if (couple.isEmpty()) {
            coupleRepository.delete(couple);
            report.setDeletedCouples(report.getDeletedCouples() + 1);
            log.error("RECONCILIATION: deleted couple {} after removing its last member", coupleId);
        } else {
            coupleRepository.save(couple);
        }
        coupleRepository.flush();
    }

    private void clearDanglingPointer(Long userId, Report report) {
        List<User> locked = userRepository.findAllByIdForUpdate(List.of(userId));
        if (locked.isEmpty()) {
            return;
        }
        User user = locked.get(0);
        if (!user.isInCouple() || coupleRepository.isMember(user.getCoupleId(), userId)) {
            return;
        }
        log.error("RECONCILIATION: cleared pointer of user {} to couple {} which does not list them",
                userId, user.getCoupleId());
        user.setCoupleId(null);
        userRepository.save(user);
        report.setClearedPointers(report.getClearedPointers() + 1);
    }
}
