package com.blissfly.proxy.core.fetch;

import com.blissfly.proxy.core.exceptions.CircularRedirectException;
import com.blissfly.proxy.core.exceptions.TooManyRedirectsException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RedirectChainTest {

    @Test
    void follow_recordsHopsInOrder() {
        RedirectChain chain = new RedirectChain("http://a.test/", 5);
        chain.follow("http://b.test/");
        chain.follow("http://c.test/");

        assertThat(chain.hops()).isEqualTo(2);
        assertThat(chain.urls()).containsExactly("http://a.test/", "http://b.test/", "http://c.test/");
    }

    @Test
    void follow_detectsLoopBackToStart() {
        RedirectChain chain = new RedirectChain("http://a.test/", 5);
        chain.follow("http://b.test/");

        assertThatThrownBy(() -> chain.follow("HTTP://A.TEST:80/"))
                .isInstanceOf(CircularRedirectException.class);
    }

    @Test
    void follow_enforcesLimit() {
        RedirectChain chain = new RedirectChain("http://a.test/0", 2);
        chain.follow("http://a.test/1");
        chain.follow("http://a.test/2");

        assertThatThrownBy(() -> chain.follow("http://a.test/3"))
                .isInstanceOf(TooManyRedirectsException.class)
                .hasMessageContaining("limit 2");
        assertThat(chain.urls()).hasSize(3);
    }

    @Test
    void zeroLimit_rejectsFirstRedirect() {
        RedirectChain chain = new RedirectChain("http://a.test/", 0);

        assertThatThrownBy(() -> chain.follow("http://b.test/"))
                .isInstanceOf(TooManyRedirectsException.class);
    }
}
