package bahn.vision.global.lock;

/**
 * 획득한 singleflight 락의 소유 증표
 *
 * @param key 보호 대상 캐시 키
 * @param lockKey 저장소에 기록된 락 키
 * @param holder 소유자 토큰 (해제 시 compare-and-delete 비교값)
 */
public record LockToken(String key, String lockKey, String holder) {}
