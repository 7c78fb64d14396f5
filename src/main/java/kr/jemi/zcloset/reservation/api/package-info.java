@org.springframework.modulith.NamedInterface("api")
package kr.jemi.zcloset.reservation.api;
